package com.linkscout.core.model;

import java.util.Locale;

/** 링크가 발견된 문서 구조 영역 */
public enum SourceRegion {
    NAVIGATION, HEADER, FOOTER, MAIN_CONTENT, SIDEBAR, BREADCRUMB, CONTENT, UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
