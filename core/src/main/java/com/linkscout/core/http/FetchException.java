package com.linkscout.core.http;

import com.linkscout.core.model.ErrorKind;

import java.util.Objects;

/** 페이지 한 장을 가져오지 못함. 크롤 전체를 멈추지 않고 CrawlError로 기록된다. */
public class FetchException extends Exception {

    private final ErrorKind kind;
    private final int status;

    public FetchException(ErrorKind kind, String message) {
        this(kind, -1, message, null);
    }

    public FetchException(ErrorKind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public FetchException(ErrorKind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.status = status;
    }

    public static FetchException httpStatus(int status, String url) {
        return new FetchException(ErrorKind.HTTP_ERROR, status, "HTTP " + status + " for " + url, null);
    }

    public ErrorKind getKind() { return kind; }

    /** HTTP_ERROR일 때만 의미 있음(그 외 -1) */
    public int getStatus() { return status; }
}
