package com.linkscout.core.service;

import com.linkscout.core.model.CrawlInfo;
import com.linkscout.core.model.CrawlResult;
import com.linkscout.core.model.Link;
import com.linkscout.core.model.LinkType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** 크롤 결과 + 요약 집계(출력 포맷 변환은 호출자 몫) */
public record CrawlReport(
        CrawlResult result,
        CrawlInfo info,
        Map<LinkType, Integer> countsByType,
        int internalLinks,
        int subdomainLinks,
        int externalLinks,
        int validatedLinks,
        int accessibleLinks) {

    public static CrawlReport of(CrawlResult r) {
        Map<LinkType, Integer> byType = new EnumMap<>(LinkType.class);
        int internal = 0, sub = 0, external = 0, validated = 0, accessible = 0;
        for (Link l : r.getLinks()) {
            byType.merge(l.getLinkType(), 1, Integer::sum);
            if (l.isInternal()) internal++;
            if (l.isSubdomain()) sub++;
            if (!l.isInternal() && !l.isSubdomain()) external++;
            if (l.getValidation() != null) {
                validated++;
                if (l.getValidation().accessible()) accessible++;
            }
        }
        return new CrawlReport(r, r.info(), Collections.unmodifiableMap(byType),
                internal, sub, external, validated, accessible);
    }

    public int count(LinkType t) {
        return countsByType.getOrDefault(t, 0);
    }
}
