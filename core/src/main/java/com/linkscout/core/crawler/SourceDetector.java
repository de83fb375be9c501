package com.linkscout.core.crawler;

import com.linkscout.core.model.SourceRegion;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 링크가 놓인 문서 영역 판정.
 *
 * 링크의 조상을 가까운 것부터 올라가며 각 조상을 아래 순서로 검사한다. 처음 맞는 조상이 결정.
 *  1) 시맨틱 태그: nav, header, footer, aside, main/article
 *  2) class + id 문자열(소문자)의 키워드 부분 일치:
 *     nav/menu → navigation, header/top → header, footer/bottom → footer,
 *     sidebar/side/widget → sidebar, breadcrumb/crumb → breadcrumb,
 *     content/article/post → main_content
 *     짧은 키워드(top, side, post)는 '-', '_', 공백으로 나눈 토큰과 완전 일치해야 한다(topic, inside, poster 제외).
 * body 자신의 class/id까지 보고도 못 찾으면 content, body 밖(head 등)이면 unknown.
 */
public final class SourceDetector {
    private SourceDetector(){}

    private static final Map<String, SourceRegion> SEMANTIC_TAGS = Map.of(
            "nav", SourceRegion.NAVIGATION,
            "header", SourceRegion.HEADER,
            "footer", SourceRegion.FOOTER,
            "aside", SourceRegion.SIDEBAR,
            "main", SourceRegion.MAIN_CONTENT,
            "article", SourceRegion.MAIN_CONTENT);

    /** contains = 부분 일치 키워드, tokens = 토큰 완전 일치 키워드 */
    private record KeywordRule(SourceRegion region, List<String> contains, List<String> tokens) {
        boolean matches(String attrs, List<String> attrTokens) {
            for (String k : contains) {
                if (attrs.contains(k)) return true;
            }
            for (String k : tokens) {
                if (attrTokens.contains(k)) return true;
            }
            return false;
        }
    }

    // 순서 = 우선순위
    private static final List<KeywordRule> KEYWORD_RULES = List.of(
            new KeywordRule(SourceRegion.NAVIGATION, List.of("nav", "menu"), List.of()),
            new KeywordRule(SourceRegion.HEADER, List.of("header", "topbar"), List.of("top")),
            new KeywordRule(SourceRegion.FOOTER, List.of("footer", "bottom"), List.of()),
            new KeywordRule(SourceRegion.SIDEBAR, List.of("sidebar", "widget"), List.of("side")),
            new KeywordRule(SourceRegion.BREADCRUMB, List.of("breadcrumb", "crumb"), List.of()),
            new KeywordRule(SourceRegion.MAIN_CONTENT, List.of("content", "article"), List.of("post", "posts")));

    public static SourceRegion detect(DomNode link) {
        if (link == null) return SourceRegion.UNKNOWN;
        for (DomNode n = link.parent(); n != null; n = n.parent()) {
            String tag = lower(n.tagName());
            if ("body".equals(tag)) {
                SourceRegion r = matchKeywords(n);
                return (r != null) ? r : SourceRegion.CONTENT;
            }

            SourceRegion r = SEMANTIC_TAGS.get(tag);
            if (r != null) return r;

            r = matchKeywords(n);
            if (r != null) return r;
        }
        return SourceRegion.UNKNOWN;
    }

    private static SourceRegion matchKeywords(DomNode n) {
        String attrs = (lower(n.className()) + " " + lower(n.id())).trim();
        if (attrs.isEmpty()) return null;
        List<String> tokens = Arrays.asList(attrs.split("[\\s_\\-]+"));
        for (KeywordRule rule : KEYWORD_RULES) {
            if (rule.matches(attrs, tokens)) return rule.region();
        }
        return null;
    }

    private static String lower(String s) {
        return (s == null) ? "" : s.toLowerCase(Locale.ROOT);
    }
}
