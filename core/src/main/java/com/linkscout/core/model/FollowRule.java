package com.linkscout.core.model;

/** 발견된 링크 중 어떤 것을 프론티어에 넣을지 결정하는 규칙 */
public enum FollowRule {
    /** 내부 링크만 (includeSubdomains=true면 서브도메인도 내부로 분류됨) */
    INTERNAL_ONLY,
    /** 내부 + 서브도메인 */
    INTERNAL_AND_SUBDOMAINS,
    /** 도메인 무관 */
    ALL;

    public boolean follows(Link link) {
        switch (this) {
            case INTERNAL_ONLY: return link.isInternal();
            case INTERNAL_AND_SUBDOMAINS: return link.isInternal() || link.isSubdomain();
            default: return true;
        }
    }
}
