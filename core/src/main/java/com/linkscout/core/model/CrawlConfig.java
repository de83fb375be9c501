package com.linkscout.core.model;

import com.linkscout.core.util.UrlUtils;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상): 순수 설정 보관용.
 * validate()가 실패하면 크롤은 시작되지 않는다(ConfigError).
 */
public final class CrawlConfig {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; LinkScout/0.1; +crawler)";

    /** 주석 추출 하위 설정: YAML `comments:` 섹션 */
    public static final class CommentsCfg {
        private boolean enabled = false;
        /** html | javascript | js_single | js_multi (null이면 전체) */
        private String type;
        private int minLength = 0;

        public boolean isEnabled() { return enabled; }
        public CommentsCfg setEnabled(boolean v) { this.enabled = v; return this; }
        public String getType() { return type; }
        public CommentsCfg setType(String v) { this.type = v; return this; }
        public int getMinLength() { return minLength; }
        public CommentsCfg setMinLength(int v) { this.minLength = v; return this; }
    }

    /** 크롤 후 필터: YAML `filter:` 섹션. 지정된 조건끼리는 AND */
    public static final class FilterCfg {
        private boolean internalOnly;
        private boolean externalOnly;
        private boolean subdomainsOnly;
        private List<String> types = List.of();
        private List<String> extensions = List.of();

        public boolean isInternalOnly() { return internalOnly; }
        public FilterCfg setInternalOnly(boolean v) { this.internalOnly = v; return this; }
        public boolean isExternalOnly() { return externalOnly; }
        public FilterCfg setExternalOnly(boolean v) { this.externalOnly = v; return this; }
        public boolean isSubdomainsOnly() { return subdomainsOnly; }
        public FilterCfg setSubdomainsOnly(boolean v) { this.subdomainsOnly = v; return this; }
        public List<String> getTypes() { return types; }
        public FilterCfg setTypes(List<String> v) { this.types = (v == null) ? List.of() : List.copyOf(v); return this; }
        public List<String> getExtensions() { return extensions; }
        public FilterCfg setExtensions(List<String> v) { this.extensions = (v == null) ? List.of() : List.copyOf(v); return this; }

        public boolean isEmpty() {
            return !internalOnly && !externalOnly && !subdomainsOnly && types.isEmpty() && extensions.isEmpty();
        }
    }

    /** 링크 검증: YAML `validation:` 섹션 */
    public static final class ValidationCfg {
        private boolean enabled = false;
        /** 초당 검증 요청 상한 */
        private int rps = 10;

        public boolean isEnabled() { return enabled; }
        public ValidationCfg setEnabled(boolean v) { this.enabled = v; return this; }
        public int getRps() { return rps; }
        public ValidationCfg setRps(int v) { this.rps = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private String target;                       // 시드 URL (필수)
    private int maxDepth = 2;                    // 시드=0
    private int maxPages = 50;                   // 가져올 페이지 상한(실패 포함)
    private Map<String, String> headers = new LinkedHashMap<>();
    private String userAgent = DEFAULT_USER_AGENT;
    private FollowRule followRule = FollowRule.INTERNAL_ONLY;
    private boolean includeSubdomains = false;   // 서브도메인을 내부로 분류
    private boolean allowDuplicates = false;
    private Duration timeout = Duration.ofSeconds(10);
    private int concurrency = 2;
    private boolean renderJs = false;
    private boolean followRedirects = true;
    private boolean extractMedia = false;        // img/script/iframe 등 src 수집
    private boolean extractSrcset = false;
    private Path screenshot;                     // 단일 페이지 모드 + renderJs 에서만 저장

    private CommentsCfg comments = new CommentsCfg();
    private FilterCfg filter = new FilterCfg();
    private ValidationCfg validation = new ValidationCfg();

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public Map<String, String> getHeaders() { return headers; }
    public String getUserAgent() { return userAgent; }
    public FollowRule getFollowRule() { return followRule; }
    public boolean isIncludeSubdomains() { return includeSubdomains; }
    public boolean isAllowDuplicates() { return allowDuplicates; }
    public Duration getTimeout() { return timeout; }
    public int getConcurrency() { return concurrency; }
    public boolean isRenderJs() { return renderJs; }
    public boolean isFollowRedirects() { return followRedirects; }
    public boolean isExtractMedia() { return extractMedia; }
    public boolean isExtractSrcset() { return extractSrcset; }
    public Path getScreenshot() { return screenshot; }
    public CommentsCfg getComments() { return comments; }
    public FilterCfg getFilter() { return filter; }
    public ValidationCfg getValidation() { return validation; }

    /** 정규화된 시드 URI. 잘못된 target이면 InvalidUrlException */
    public URI getTargetUri() {
        return UrlUtils.parseAbsolute(target);
    }

    /** 요청 헤더 + User-Agent (헤더에 명시된 값이 우선) */
    public Map<String, String> effectiveHeaders() {
        Map<String, String> out = new LinkedHashMap<>();
        if (userAgent != null && !userAgent.isBlank()) out.put("User-Agent", userAgent);
        out.putAll(headers);
        return out;
    }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setHeaders(Map<String, String> headers) {
        this.headers = (headers == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
        return this;
    }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setFollowRule(FollowRule followRule) {
        this.followRule = (followRule != null ? followRule : FollowRule.INTERNAL_ONLY);
        return this;
    }
    public CrawlConfig setIncludeSubdomains(boolean v) { this.includeSubdomains = v; return this; }
    public CrawlConfig setAllowDuplicates(boolean v) { this.allowDuplicates = v; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public CrawlConfig setRenderJs(boolean v) { this.renderJs = v; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setExtractMedia(boolean v) { this.extractMedia = v; return this; }
    public CrawlConfig setExtractSrcset(boolean v) { this.extractSrcset = v; return this; }
    public CrawlConfig setScreenshot(Path v) { this.screenshot = v; return this; }
    public CrawlConfig setComments(CommentsCfg c) { this.comments = (c != null ? c : new CommentsCfg()); return this; }
    public CrawlConfig setFilter(FilterCfg f) { this.filter = (f != null ? f : new FilterCfg()); return this; }
    public CrawlConfig setValidation(ValidationCfg v) { this.validation = (v != null ? v : new ValidationCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        getTargetUri(); // http(s) 절대 URL이 아니면 예외
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages <= 0) throw new IllegalArgumentException("maxPages must be > 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(followRule, "followRule");

        Objects.requireNonNull(comments, "comments");
        if (comments.getMinLength() < 0)
            throw new IllegalArgumentException("comments.minLength must be >= 0");
        CommentType.parseFilter(comments.getType()); // 모르는 타입이면 예외

        Objects.requireNonNull(filter, "filter");
        if (filter.isInternalOnly() && filter.isExternalOnly())
            throw new IllegalArgumentException("filter.internalOnly and filter.externalOnly are mutually exclusive");
        for (String t : filter.getTypes()) {
            if (t == null || t.isBlank()) throw new IllegalArgumentException("filter.types has blank entries");
        }

        Objects.requireNonNull(validation, "validation");
        if (validation.getRps() <= 0) throw new IllegalArgumentException("validation.rps must be > 0");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    /** jsoup 등 int ms 필요 시 */
    public int getTimeoutMsInt() {
        long ms = getTimeoutMs();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }
}
