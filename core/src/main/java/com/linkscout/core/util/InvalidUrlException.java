package com.linkscout.core.util;

/** 해석/정규화할 수 없는 href. 링크 단위로만 처리되며 크롤을 중단시키지 않는다. */
public class InvalidUrlException extends IllegalArgumentException {

    private final String href;

    public InvalidUrlException(String href, String reason) {
        super("Invalid URL [" + href + "]: " + reason);
        this.href = href;
    }

    public InvalidUrlException(String href, Throwable cause) {
        super("Invalid URL [" + href + "]: " + cause.getMessage(), cause);
        this.href = href;
    }

    public String getHref() { return href; }
}
