package com.linkscout.core.model;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/** 크롤 1회분 입력(불변). CrawlConfig에서 한 번만 만든다. */
public record SeedRequest(URI startUrl, int maxDepth, int maxPages, Map<String, String> headers, FollowRule followRule) {

    public SeedRequest {
        Objects.requireNonNull(startUrl, "startUrl");
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
        followRule = (followRule == null) ? FollowRule.INTERNAL_ONLY : followRule;
    }

    /** config.validate() 통과 이후 호출 전제 */
    public static SeedRequest from(CrawlConfig cfg) {
        return new SeedRequest(cfg.getTargetUri(), cfg.getMaxDepth(), cfg.getMaxPages(),
                cfg.effectiveHeaders(), cfg.getFollowRule());
    }
}
