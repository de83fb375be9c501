package com.linkscout.core.crawler;

import com.linkscout.core.model.Link;
import com.linkscout.core.util.InvalidUrlException;
import com.linkscout.core.util.UrlUtils;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * 크롤 전체 범위의 링크 중복 제거. 스케줄러(단일 스레드 병합 구간)에서만 사용.
 * allowDuplicates=false: 처음 본 것만 통과
 * allowDuplicates=true : 모두 통과, 반복분은 duplicateOf=최초 발견 페이지
 */
final class LinkDeduplicator {

    private final boolean allowDuplicates;
    private final Map<String, String> firstSeenOn = new HashMap<>();

    LinkDeduplicator(boolean allowDuplicates) {
        this.allowDuplicates = allowDuplicates;
    }

    /** 결과에 넣을 링크, 버릴 거면 null */
    Link accept(Link link) {
        String first = firstSeenOn.putIfAbsent(keyOf(link), String.valueOf(link.getFoundOnPage()));
        if (first == null) return link;
        return allowDuplicates ? link.withDuplicateOf(first) : null;
    }

    int uniqueCount() { return firstSeenOn.size(); }

    static String keyOf(Link link) {
        if (!link.isCrawlable()) return link.getResolvedUrl();
        try {
            return UrlUtils.dedupKey(URI.create(link.getResolvedUrl()));
        } catch (IllegalArgumentException e) { // InvalidUrlException 포함
            return link.getResolvedUrl();
        }
    }
}
