package com.linkscout.core.util;

import com.linkscout.core.model.LinkType;

import java.net.URI;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 링크 타입 분류.
 * 우선순위: 확장자 테이블 → (경로에 "api" 또는 쿼리 존재) API → 확장자 없음 PAGE → OTHER.
 * .json 처럼 API 성격이어도 확장자 매칭이 이긴다.
 */
public final class LinkTypes {
    private LinkTypes(){}

    private static final Map<String, LinkType> BY_EXT = new HashMap<>();
    static {
        reg(LinkType.DOCUMENT, "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "txt", "rtf");
        reg(LinkType.IMAGE, "jpg", "jpeg", "png", "gif", "svg", "webp", "bmp", "ico");
        reg(LinkType.VIDEO, "mp4", "avi", "mkv", "mov", "webm", "wmv", "flv");
        reg(LinkType.AUDIO, "mp3", "wav", "flac", "ogg", "aac", "wma");
        reg(LinkType.ARCHIVE, "zip", "rar", "tar", "gz", "7z", "bz2");
        reg(LinkType.CODE, "js", "css", "json", "html", "htm", "xml", "php");
    }

    private static void reg(LinkType t, String... exts) {
        for (String e : exts) BY_EXT.put(e, t);
    }

    /** 확장자가 있어도 HTML 문서로 취급해 따라갈 수 있는 것들 */
    private static final Set<String> PAGE_EXTS = Set.of("html", "htm", "php", "asp", "aspx", "jsp", "shtml");

    /** 필터용 타입 그룹(복수형 이름) */
    private static final Map<String, Set<LinkType>> GROUPS;
    static {
        Map<String, Set<LinkType>> g = new LinkedHashMap<>();
        g.put("images", EnumSet.of(LinkType.IMAGE));
        g.put("documents", EnumSet.of(LinkType.DOCUMENT));
        g.put("media", EnumSet.of(LinkType.VIDEO, LinkType.AUDIO));
        g.put("pages", EnumSet.of(LinkType.PAGE));
        g.put("files", EnumSet.of(LinkType.DOCUMENT, LinkType.IMAGE, LinkType.VIDEO, LinkType.AUDIO, LinkType.ARCHIVE));
        g.put("code", EnumSet.of(LinkType.CODE));
        g.put("api", EnumSet.of(LinkType.API));
        GROUPS = Collections.unmodifiableMap(g);
    }

    public static LinkType classify(URI u) {
        if (u == null) return LinkType.OTHER;
        String ext = UrlUtils.extensionOf(u);
        LinkType byExt = BY_EXT.get(ext);
        if (byExt != null) return byExt;

        String path = (u.getPath() == null) ? "" : u.getPath().toLowerCase(Locale.ROOT);
        String q = u.getRawQuery();
        if (path.contains("api") || (q != null && !q.isEmpty())) return LinkType.API;

        return ext.isEmpty() ? LinkType.PAGE : LinkType.OTHER;
    }

    /** 프론티어에 넣어 HTML로 가져올 만한 경로인지(확장자 없음 또는 서버 페이지 확장자) */
    public static boolean isCrawlablePage(URI u) {
        String ext = UrlUtils.extensionOf(u);
        return ext.isEmpty() || PAGE_EXTS.contains(ext);
    }

    /**
     * 필터 토큰 → 타입 집합. 그룹 이름(images, media ...) 또는 단수 타입 라벨(image, pdf 아님).
     * 둘 다 아니면 빈 집합(확장자 토큰으로만 쓰임).
     */
    public static Set<LinkType> expand(String token) {
        if (token == null) return EnumSet.noneOf(LinkType.class);
        String k = token.trim().toLowerCase(Locale.ROOT);
        Set<LinkType> g = GROUPS.get(k);
        if (g != null) return EnumSet.copyOf(g);
        LinkType t = LinkType.fromLabel(k);
        return (t == null) ? EnumSet.noneOf(LinkType.class) : EnumSet.of(t);
    }

}
