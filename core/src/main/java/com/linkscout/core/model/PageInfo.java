package com.linkscout.core.model;

import java.util.List;

/** 크롤한 페이지 한 장의 메타데이터(링크 집계 + 선택적 주석). */
public record PageInfo(
        String url,
        String finalUrl,
        int depth,
        int status,
        String title,
        int linksOnPage,
        int internalLinks,
        int externalLinks,
        int subdomainLinks,
        int filesFound,
        boolean jsFallback,
        List<PageComment> comments) {

    public PageInfo {
        title = (title == null) ? "" : title;
        comments = (comments == null) ? List.of() : List.copyOf(comments);
    }

    /** 페이지에서 추출된 링크로 집계값을 계산 */
    public static PageInfo summarize(FrontierEntry entry, PageFetchResult fetched, String title,
                                     List<Link> links, List<PageComment> comments) {
        int internal = 0, external = 0, sub = 0, files = 0;
        for (Link l : links) {
            if (l.isInternal()) internal++;
            if (l.isSubdomain()) sub++;
            if (!l.isInternal() && !l.isSubdomain()) external++;
            if (l.getLinkType() != LinkType.PAGE) files++;
        }
        return new PageInfo(
                entry.url().toString(),
                fetched.getFinalUrl().toString(),
                entry.depth(),
                fetched.getStatus(),
                title,
                links.size(), internal, external, sub, files,
                fetched.isJsFallback(),
                comments);
    }
}
