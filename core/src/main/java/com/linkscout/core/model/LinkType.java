package com.linkscout.core.model;

import java.util.Locale;

/** 링크 대상의 콘텐츠 분류. label()은 외부 표기(소문자)용. */
public enum LinkType {
    PAGE, IMAGE, DOCUMENT, VIDEO, AUDIO, ARCHIVE, CODE, API, OTHER;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** "image" / "IMAGE" 모두 허용. 모르면 null. */
    public static LinkType fromLabel(String s) {
        if (s == null) return null;
        String k = s.trim().toUpperCase(Locale.ROOT);
        for (LinkType t : values()) {
            if (t.name().equals(k)) return t;
        }
        return null;
    }
}
