package com.linkscout.core.service;

import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlResult;
import com.linkscout.core.model.Link;
import com.linkscout.core.model.LinkType;
import com.linkscout.core.util.LinkTypes;
import com.linkscout.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 크롤 후 링크 필터. 지정한 조건끼리는 AND.
 * - internalOnly / externalOnly(내부도 서브도메인도 아님) / subdomainsOnly
 * - types: 그룹(images, documents, media, pages, files, code, api) 또는 타입 라벨.
 *   URL에 ".토큰"이 들어 있어도 통과(예: types=[pdf])
 * - extensions: 경로 확장자 일치
 */
public final class LinkFilter implements Predicate<Link> {

    private final boolean internalOnly;
    private final boolean externalOnly;
    private final boolean subdomainsOnly;
    private final List<String> typeTokens;
    private final Set<LinkType> types;
    private final Set<String> extensions;

    private LinkFilter(Builder b) {
        this.internalOnly = b.internalOnly;
        this.externalOnly = b.externalOnly;
        this.subdomainsOnly = b.subdomainsOnly;
        this.typeTokens = List.copyOf(b.typeTokens);
        Set<LinkType> t = EnumSet.noneOf(LinkType.class);
        for (String token : typeTokens) t.addAll(LinkTypes.expand(token));
        this.types = t;
        this.extensions = Set.copyOf(b.extensions);
    }

    public static LinkFilter fromConfig(CrawlConfig.FilterCfg f) {
        Objects.requireNonNull(f, "filter");
        return builder()
                .internalOnly(f.isInternalOnly())
                .externalOnly(f.isExternalOnly())
                .subdomainsOnly(f.isSubdomainsOnly())
                .types(f.getTypes())
                .extensions(f.getExtensions())
                .build();
    }

    public static LinkFilter acceptAll() { return builder().build(); }

    public boolean isEmpty() {
        return !internalOnly && !externalOnly && !subdomainsOnly && typeTokens.isEmpty() && extensions.isEmpty();
    }

    @Override
    public boolean test(Link l) {
        if (internalOnly && !l.isInternal()) return false;
        if (externalOnly && (l.isInternal() || l.isSubdomain())) return false;
        if (subdomainsOnly && !l.isSubdomain()) return false;
        if (!typeTokens.isEmpty() && !matchesType(l)) return false;
        if (!extensions.isEmpty() && !extensions.contains(extensionOf(l))) return false;
        return true;
    }

    private boolean matchesType(Link l) {
        if (types.contains(l.getLinkType())) return true;
        String url = l.getResolvedUrl().toLowerCase(Locale.ROOT);
        for (String t : typeTokens) {
            if (url.contains("." + t)) return true;
        }
        return false;
    }

    private static String extensionOf(Link l) {
        if (!l.isCrawlable()) return "";
        try {
            return UrlUtils.extensionOf(URI.create(l.getResolvedUrl()));
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /** 순서 유지 */
    public List<Link> apply(List<Link> links) {
        List<Link> out = new ArrayList<>();
        for (Link l : links) if (test(l)) out.add(l);
        return out;
    }

    /** 링크만 걸러낸 사본. pages/errors/pagesCrawled 는 그대로 */
    public CrawlResult apply(CrawlResult result) {
        if (isEmpty()) return result;
        return result.withLinks(apply(result.getLinks()));
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private boolean internalOnly;
        private boolean externalOnly;
        private boolean subdomainsOnly;
        private final Set<String> typeTokens = new LinkedHashSet<>();
        private final Set<String> extensions = new LinkedHashSet<>();

        public Builder internalOnly(boolean v) { this.internalOnly = v; return this; }
        public Builder externalOnly(boolean v) { this.externalOnly = v; return this; }
        public Builder subdomainsOnly(boolean v) { this.subdomainsOnly = v; return this; }

        public Builder types(List<String> v) {
            if (v != null) for (String s : v) if (s != null && !s.isBlank()) typeTokens.add(s.trim().toLowerCase(Locale.ROOT));
            return this;
        }

        /** ".pdf" / "PDF" / "pdf" 모두 pdf */
        public Builder extensions(List<String> v) {
            if (v != null) {
                for (String s : v) {
                    if (s == null || s.isBlank()) continue;
                    String e = s.trim().toLowerCase(Locale.ROOT);
                    extensions.add(e.startsWith(".") ? e.substring(1) : e);
                }
            }
            return this;
        }

        public LinkFilter build() {
            if (internalOnly && externalOnly) {
                throw new IllegalArgumentException("internalOnly and externalOnly are mutually exclusive");
            }
            return new LinkFilter(this);
        }
    }
}
