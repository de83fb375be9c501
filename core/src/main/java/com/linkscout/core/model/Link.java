package com.linkscout.core.model;

import java.util.Objects;

/**
 * 추출된 링크 한 건(불변).
 * resolvedUrl은 정규화된 절대 URL. http(s)가 아닌 스킴(mailto/tel/javascript/data)은 원문 href를 그대로 담는다.
 */
public final class Link {
    private final String rawHref;
    private final String resolvedUrl;
    private final String text;
    private final String domain;
    private final boolean internal;
    private final boolean subdomain;
    private final boolean crawlable;
    private final LinkType linkType;
    private final SourceRegion sourceRegion;
    private final String foundOnPage;
    private final String duplicateOf;
    private final ValidationStatus validation;

    private Link(Builder b) {
        this.rawHref = b.rawHref;
        this.resolvedUrl = b.resolvedUrl;
        this.text = (b.text == null) ? "" : b.text;
        this.domain = (b.domain == null) ? "" : b.domain;
        this.internal = b.internal;
        this.subdomain = b.subdomain;
        this.crawlable = b.crawlable;
        this.linkType = (b.linkType == null) ? LinkType.OTHER : b.linkType;
        this.sourceRegion = (b.sourceRegion == null) ? SourceRegion.UNKNOWN : b.sourceRegion;
        this.foundOnPage = b.foundOnPage;
        this.duplicateOf = b.duplicateOf;
        this.validation = b.validation;
    }

    public String getRawHref() { return rawHref; }
    public String getResolvedUrl() { return resolvedUrl; }
    public String getText() { return text; }
    public String getDomain() { return domain; }
    public boolean isInternal() { return internal; }
    public boolean isSubdomain() { return subdomain; }
    /** http(s) 링크만 true. false면 절대 페이지로 가져오지 않는다. */
    public boolean isCrawlable() { return crawlable; }
    public LinkType getLinkType() { return linkType; }
    public SourceRegion getSourceRegion() { return sourceRegion; }
    public String getFoundOnPage() { return foundOnPage; }
    /** 중복 허용 모드에서 반복 발견된 링크면 최초 발견 페이지 URL, 아니면 null */
    public String getDuplicateOf() { return duplicateOf; }
    /** 검증 전이면 null */
    public ValidationStatus getValidation() { return validation; }

    public Link withDuplicateOf(String firstSeenOn) {
        return toBuilder().duplicateOf(firstSeenOn).build();
    }

    public Link withValidation(ValidationStatus status) {
        return toBuilder().validation(status).build();
    }

    public Builder toBuilder() {
        return builder()
                .rawHref(rawHref)
                .resolvedUrl(resolvedUrl)
                .text(text)
                .domain(domain)
                .internal(internal)
                .subdomain(subdomain)
                .crawlable(crawlable)
                .linkType(linkType)
                .sourceRegion(sourceRegion)
                .foundOnPage(foundOnPage)
                .duplicateOf(duplicateOf)
                .validation(validation);
    }

    @Override
    public String toString() {
        return "Link{" + resolvedUrl + ", type=" + linkType.label() + ", source=" + sourceRegion.label()
                + ", internal=" + internal + ", subdomain=" + subdomain + ", on=" + foundOnPage + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String rawHref;
        private String resolvedUrl;
        private String text;
        private String domain;
        private boolean internal;
        private boolean subdomain;
        private boolean crawlable;
        private LinkType linkType;
        private SourceRegion sourceRegion;
        private String foundOnPage;
        private String duplicateOf;
        private ValidationStatus validation;

        public Builder rawHref(String v) { this.rawHref = v; return this; }
        public Builder resolvedUrl(String v) { this.resolvedUrl = v; return this; }
        public Builder text(String v) { this.text = v; return this; }
        public Builder domain(String v) { this.domain = v; return this; }
        public Builder internal(boolean v) { this.internal = v; return this; }
        public Builder subdomain(boolean v) { this.subdomain = v; return this; }
        public Builder crawlable(boolean v) { this.crawlable = v; return this; }
        public Builder linkType(LinkType v) { this.linkType = v; return this; }
        public Builder sourceRegion(SourceRegion v) { this.sourceRegion = v; return this; }
        public Builder foundOnPage(String v) { this.foundOnPage = v; return this; }
        public Builder duplicateOf(String v) { this.duplicateOf = v; return this; }
        public Builder validation(ValidationStatus v) { this.validation = v; return this; }

        public Link build() {
            Objects.requireNonNull(resolvedUrl, "resolvedUrl");
            if (resolvedUrl.isBlank()) throw new IllegalArgumentException("resolvedUrl must not be blank");
            return new Link(this);
        }
    }
}
