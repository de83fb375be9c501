package com.linkscout.core.util;

import java.net.IDN;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** URL 해석/정규화 + 중복 키 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*):");

    /** href의 스킴(소문자). 스킴이 없으면(상대 경로) null */
    public static String schemeOf(String href) {
        if (href == null) return null;
        Matcher m = SCHEME.matcher(href.trim());
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : null;
    }

    /** 상대 경로(null) 또는 http/https만 페이지로 가져올 수 있다. mailto/tel/javascript/data 등은 false */
    public static boolean isCrawlableScheme(String scheme) {
        return scheme == null || "http".equals(scheme) || "https".equals(scheme);
    }

    /** 시드처럼 그 자체로 절대 http(s) URL이어야 하는 값 파싱 */
    public static URI parseAbsolute(String url) {
        if (url == null || url.isBlank()) throw new InvalidUrlException(String.valueOf(url), "empty");
        String s = url.trim();
        String scheme = schemeOf(s);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new InvalidUrlException(s, "absolute http(s) URL required");
        }
        return resolve(s, null);
    }

    /**
     * href를 base 기준 절대 URL로 해석한 뒤 정규화.
     * base가 null이면 href 자체가 절대 URL이어야 한다.
     */
    public static URI resolve(String rawHref, URI base) {
        if (rawHref == null || rawHref.isBlank()) throw new InvalidUrlException(String.valueOf(rawHref), "empty href");
        String href = rawHref.trim();
        if (!isCrawlableScheme(schemeOf(href))) {
            throw new InvalidUrlException(href, "non-http scheme");
        }
        try {
            URL abs = (base == null)
                    ? new URL(href)
                    : new URL(normalize(base).toURL(), href); // 빈 경로 base("https://a.com")도 "/" 기준으로 해석
            String host = abs.getHost();
            if (host == null || host.isEmpty()) throw new InvalidUrlException(href, "missing host");
            if (!isAscii(host)) host = IDN.toASCII(host, IDN.ALLOW_UNASSIGNED); // bücher.de → xn--bcher-kva.de

            StringBuilder sb = new StringBuilder(href.length() + 16);
            sb.append(abs.getProtocol()).append("://");
            if (abs.getUserInfo() != null) sb.append(escapeIllegal(abs.getUserInfo())).append('@');
            sb.append(host);
            if (abs.getPort() != -1) sb.append(':').append(abs.getPort());
            sb.append(escapeIllegal(abs.getPath()));
            if (abs.getQuery() != null) sb.append('?').append(escapeIllegal(abs.getQuery()));
            return normalize(new URI(sb.toString()));
        } catch (MalformedURLException | URISyntaxException | IllegalArgumentException e) {
            if (e instanceof InvalidUrlException iue) throw iue;
            throw new InvalidUrlException(href, e);
        }
    }

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소, dot-segment 제거(루트 위로 가는 선행 ".."도 제거)
     * - query는 인코딩된 원문 그대로 유지
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getRawAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");

        // 인코딩된 원문 조각을 다시 붙인다(다중 인자 생성자는 '%'를 재인코딩하므로 사용하지 않음)
        StringBuilder prefix = new StringBuilder(32);
        prefix.append(scheme).append("://");
        if (u.getRawUserInfo() != null && u.getHost() != null) prefix.append(u.getRawUserInfo()).append('@');
        prefix.append(host);
        if (port != -1 && u.getHost() != null) prefix.append(':').append(port);
        String query = (u.getRawQuery() != null) ? "?" + u.getRawQuery() : "";
        try {
            URI n = new URI(prefix + path + query).normalize();
            String cleaned = dropLeadingDotDot(n.getRawPath());
            return cleaned.equals(n.getRawPath()) ? n : new URI(prefix + cleaned + query);
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(u.toString(), e);
        }
    }

    /** URI.normalize()가 남기는 선행 "/.." 세그먼트 제거(RFC 3986 5.2.4) */
    static String dropLeadingDotDot(String path) {
        if (path == null) return "/";
        String p = path;
        while (p.startsWith("/../")) p = p.substring(3);
        if (p.equals("/..")) p = "/";
        return p;
    }

    private static boolean isAscii(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) >= 0x80) return false;
        }
        return true;
    }

    /** URI에 쓸 수 없는 문자만 %XX(UTF-8)로. 이미 인코딩된 %XX는 그대로 둔다 */
    static String escapeIllegal(String s) {
        if (s == null || s.isEmpty()) return s;
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                sb.append(c);
            } else if (c < 0x80 && c != '%' && LEGAL.indexOf(c) >= 0) {
                sb.append(c);
            } else {
                int cp = s.codePointAt(i);
                if (Character.charCount(cp) == 2) i++;
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    sb.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
                }
            }
        }
        return sb.toString();
    }

    private static final String LEGAL =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789-_.!~*'();/?:@&=+$,";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * 중복 제거 키: 정규화 URL에서 경로 끝 슬래시까지 제거(쿼리는 유지).
     * 예) https://Ex.com:443/a/ → https://ex.com/a
     */
    public static String dedupKey(URI u) {
        URI n = normalize(u);
        StringBuilder sb = new StringBuilder(64);
        sb.append(n.getScheme()).append("://").append(n.getRawAuthority() == null ? "" : n.getRawAuthority());
        String path = n.getRawPath() == null ? "" : n.getRawPath();
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        sb.append(path);
        if (n.getRawQuery() != null) sb.append('?').append(n.getRawQuery());
        return sb.toString();
    }

    /** 경로 마지막 세그먼트의 확장자(소문자, 점 제외). 없으면 "" */
    public static String extensionOf(URI u) {
        if (u == null || u.getPath() == null) return "";
        String p = u.getPath();
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        String last = p.substring(p.lastIndexOf('/') + 1);
        int dot = last.lastIndexOf('.');
        if (dot <= 0 || dot == last.length() - 1) return ""; // ".htaccess" 나 "a." 는 확장자 없음
        return last.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
