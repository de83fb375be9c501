package com.linkscout.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 크롤 결과(불변 스냅샷).
 * links 순서 = 발견 순서. 한 페이지 안에서는 문서 순서, 페이지 간에는 프론티어 순서.
 */
public final class CrawlResult {
    private final CrawlState state;
    private final String startUrl;
    private final int maxDepth;
    private final int pagesCrawled;
    private final List<Link> links;
    private final List<PageInfo> pages;
    private final List<CrawlError> errors;
    private final List<String> warnings;

    public CrawlResult(CrawlState state, String startUrl, int maxDepth, int pagesCrawled,
                       List<Link> links, List<PageInfo> pages, List<CrawlError> errors, List<String> warnings) {
        this.state = Objects.requireNonNull(state, "state");
        this.startUrl = startUrl;
        this.maxDepth = maxDepth;
        this.pagesCrawled = pagesCrawled;
        this.links = (links == null) ? List.of() : List.copyOf(links);
        this.pages = (pages == null) ? List.of() : List.copyOf(pages);
        this.errors = (errors == null) ? List.of() : List.copyOf(errors);
        this.warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }

    public CrawlState getState() { return state; }
    public String getStartUrl() { return startUrl; }
    public int getMaxDepth() { return maxDepth; }
    public int getPagesCrawled() { return pagesCrawled; }
    public List<Link> getLinks() { return links; }
    public List<PageInfo> getPages() { return pages; }
    public List<CrawlError> getErrors() { return errors; }
    public List<String> getWarnings() { return warnings; }

    /** 링크만 교체한 사본(필터/검증 단계용) */
    public CrawlResult withLinks(List<Link> newLinks) {
        return new CrawlResult(state, startUrl, maxDepth, pagesCrawled, newLinks, pages, errors, warnings);
    }

    public CrawlInfo info() {
        int files = 0;
        for (Link l : links) {
            if (l.getLinkType() != LinkType.PAGE) files++;
        }
        return new CrawlInfo(startUrl, pagesCrawled, maxDepth, links.size(), files);
    }
}
