package com.linkscout.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DomainScope: 내부/서브도메인/외부")
class DomainScopeTest {

    @Test
    @DisplayName("www.와 맨 호스트는 같은 사이트")
    void wwwEquivalence() {
        DomainScope s = DomainScope.of(URI.create("https://www.Example.com/"), false);
        assertThat(s.seedHost()).isEqualTo("example.com");
        assertThat(s.isInternal("example.com")).isTrue();
        assertThat(s.isInternal("WWW.example.com")).isTrue();
        assertThat(s.isSubdomain("www.example.com")).isFalse();
    }

    @Test
    @DisplayName("api.example.com: 서브도메인, 기본은 내부 아님")
    void subdomainNotInternalByDefault() {
        DomainScope s = DomainScope.of(URI.create("https://example.com"), false);
        assertThat(s.isSubdomain("api.example.com")).isTrue();
        assertThat(s.isInternal("api.example.com")).isFalse();
        assertThat(s.isSubdomain("a.b.example.com")).isTrue();
    }

    @Test
    @DisplayName("includeSubdomains=true 면 서브도메인도 내부")
    void includeSubdomains() {
        DomainScope s = DomainScope.of(URI.create("https://example.com"), true);
        assertThat(s.isInternal("api.example.com")).isTrue();
        assertThat(s.isSubdomain("api.example.com")).isTrue();
    }

    @Test
    @DisplayName("접미사만 같은 다른 도메인은 외부")
    void lookalikeIsExternal() {
        DomainScope s = DomainScope.of(URI.create("https://example.com"), true);
        assertThat(s.isInternal("notexample.com")).isFalse();
        assertThat(s.isSubdomain("notexample.com")).isFalse();
        assertThat(s.isInternal("example.com.evil.org")).isFalse();
        assertThat(s.isInternal(null)).isFalse();
    }
}
