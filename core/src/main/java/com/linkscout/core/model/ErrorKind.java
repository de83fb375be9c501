package com.linkscout.core.model;

/** 페이지 단위 실패 분류 */
public enum ErrorKind {
    INVALID_URL,
    TIMEOUT,
    DNS_FAILURE,
    HTTP_ERROR,
    CONNECTION_REFUSED,
    PARSE_ERROR,
    IO,
    UNEXPECTED
}
