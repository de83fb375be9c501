package com.linkscout.core.model;

/** 크롤 요약. filesFound = linkType != PAGE 인 링크 수 */
public record CrawlInfo(String startUrl, int pagesCrawled, int maxDepth, int totalLinks, int filesFound) {}
