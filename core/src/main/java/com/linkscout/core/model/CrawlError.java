package com.linkscout.core.model;

/** 페이지 단위 실패 기록. status는 HTTP 오류일 때만 의미 있음(그 외 -1). */
public record CrawlError(String url, int depth, ErrorKind kind, int status, String message) {

    public static CrawlError of(String url, int depth, ErrorKind kind, String message) {
        return new CrawlError(url, depth, kind, -1, message);
    }
}
