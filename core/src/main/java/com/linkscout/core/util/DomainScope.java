package com.linkscout.core.util;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * 시드 호스트 기준 내부/서브도메인/외부 판정.
 * - 비교 전 앞쪽 "www." 하나를 떼어낸다(www.ex.com == ex.com)
 * - 서브도메인 = 시드 호스트의 엄격한 하위(api.ex.com ⊂ ex.com). 같은 호스트는 서브도메인이 아님
 * - includeSubdomains=true 면 서브도메인도 내부로 본다
 */
public final class DomainScope {

    private final String seedHost;
    private final boolean includeSubdomains;

    private DomainScope(String seedHost, boolean includeSubdomains) {
        this.seedHost = seedHost;
        this.includeSubdomains = includeSubdomains;
    }

    public static DomainScope of(URI seed, boolean includeSubdomains) {
        Objects.requireNonNull(seed, "seed");
        String h = seed.getHost();
        if (h == null || h.isBlank()) throw new InvalidUrlException(seed.toString(), "seed has no host");
        return new DomainScope(stripWww(h), includeSubdomains);
    }

    public static String stripWww(String host) {
        if (host == null) return "";
        String h = host.trim().toLowerCase(Locale.ROOT);
        if (h.endsWith(".")) h = h.substring(0, h.length() - 1);
        return h.startsWith("www.") ? h.substring(4) : h;
    }

    /** www 차이만 있는 동일 호스트 */
    public boolean isSameSite(String host) {
        return host != null && !host.isBlank() && stripWww(host).equals(seedHost);
    }

    public boolean isSubdomain(String host) {
        if (host == null || host.isBlank()) return false;
        String h = stripWww(host);
        return !h.equals(seedHost) && h.endsWith("." + seedHost);
    }

    public boolean isInternal(String host) {
        return isSameSite(host) || (includeSubdomains && isSubdomain(host));
    }

    public boolean isIncludeSubdomains() { return includeSubdomains; }

    /** www 제거된 시드 호스트 */
    public String seedHost() { return seedHost; }
}
