package com.linkscout.core.model;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 페처가 돌려주는 페이지 한 장.
 * document가 없으면 html을 finalUrl 기준으로 파싱한다(jsoup은 깨진 HTML도 best-effort 파싱).
 * jsFallback=true 는 JS 렌더링을 요청했지만 일반 HTTP로 대체되었음을 뜻한다(경고, 오류 아님).
 * screenshot은 렌더러가 실제로 저장한 파일 경로(요청이 없었거나 실패하면 null).
 */
public final class PageFetchResult {
    private final URI requestedUrl;
    private final URI finalUrl;
    private final int status;
    private final String html;
    private final Document document;
    private final boolean jsFallback;
    private final long elapsedMs;
    private final Path screenshot;

    private PageFetchResult(Builder b) {
        this.requestedUrl = b.requestedUrl;
        this.finalUrl = (b.finalUrl == null) ? b.requestedUrl : b.finalUrl;
        this.status = b.status;
        this.html = b.html;
        this.document = b.document;
        this.jsFallback = b.jsFallback;
        this.elapsedMs = b.elapsedMs;
        this.screenshot = b.screenshot;
    }

    public URI getRequestedUrl() { return requestedUrl; }
    public URI getFinalUrl() { return finalUrl; }
    public int getStatus() { return status; }
    public String getHtml() { return html; }
    public boolean isJsFallback() { return jsFallback; }
    public long getElapsedMs() { return elapsedMs; }
    public Path getScreenshot() { return screenshot; }

    /** 파싱된 문서. 원문만 있으면 여기서 파싱. 둘 다 없으면 null */
    public Document toDocument() {
        if (document != null) return document;
        if (html == null) return null;
        return Jsoup.parse(html, finalUrl.toString());
    }

    /** 주석 추출용 원문. 원문이 없으면 문서를 다시 직렬화 */
    public String rawHtml() {
        if (html != null) return html;
        return (document == null) ? "" : document.outerHtml();
    }

    public Builder toBuilder() {
        return builder().requestedUrl(requestedUrl).finalUrl(finalUrl).status(status)
                .html(html).document(document).jsFallback(jsFallback).elapsedMs(elapsedMs).screenshot(screenshot);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI requestedUrl;
        private URI finalUrl;
        private int status = 200;
        private String html;
        private Document document;
        private boolean jsFallback;
        private long elapsedMs;
        private Path screenshot;

        public Builder requestedUrl(URI v) { this.requestedUrl = v; return this; }
        public Builder finalUrl(URI v) { this.finalUrl = v; return this; }
        public Builder status(int v) { this.status = v; return this; }
        public Builder html(String v) { this.html = v; return this; }
        public Builder document(Document v) { this.document = v; return this; }
        public Builder jsFallback(boolean v) { this.jsFallback = v; return this; }
        public Builder elapsedMs(long v) { this.elapsedMs = v; return this; }
        public Builder screenshot(Path v) { this.screenshot = v; return this; }

        public PageFetchResult build() {
            Objects.requireNonNull(requestedUrl, "requestedUrl");
            return new PageFetchResult(this);
        }
    }
}
