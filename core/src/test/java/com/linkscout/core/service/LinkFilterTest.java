package com.linkscout.core.service;

import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlResult;
import com.linkscout.core.model.CrawlState;
import com.linkscout.core.model.Link;
import com.linkscout.core.model.LinkType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinkFilterTest {

    private static Link l(String url, LinkType type, boolean internal, boolean subdomain) {
        return Link.builder().resolvedUrl(url).linkType(type)
                .internal(internal).subdomain(subdomain).crawlable(url.startsWith("http")).build();
    }

    private static final Link PAGE = l("https://ex.com/about", LinkType.PAGE, true, false);
    private static final Link PDF = l("https://ex.com/files/report.PDF", LinkType.DOCUMENT, true, false);
    private static final Link IMG = l("https://cdn.ex.com/logo.png", LinkType.IMAGE, false, true);
    private static final Link EXT_ZIP = l("https://other.org/pkg.zip", LinkType.ARCHIVE, false, false);
    private static final Link MAIL = l("mailto:hi@ex.com", LinkType.OTHER, false, false);
    private static final List<Link> ALL = List.of(PAGE, PDF, IMG, EXT_ZIP, MAIL);

    @Test
    @DisplayName("도메인 조건: internal / external(서브도메인 제외) / subdomains")
    void domainConditions() {
        assertThat(LinkFilter.builder().internalOnly(true).build().apply(ALL)).containsExactly(PAGE, PDF);
        assertThat(LinkFilter.builder().externalOnly(true).build().apply(ALL)).containsExactly(EXT_ZIP, MAIL);
        assertThat(LinkFilter.builder().subdomainsOnly(true).build().apply(ALL)).containsExactly(IMG);
    }

    @Test
    @DisplayName("타입 그룹, 타입 라벨, URL 안의 .토큰")
    void typeConditions() {
        assertThat(LinkFilter.builder().types(List.of("files")).build().apply(ALL)).containsExactly(PDF, IMG, EXT_ZIP);
        assertThat(LinkFilter.builder().types(List.of("Images")).build().apply(ALL)).containsExactly(IMG);
        assertThat(LinkFilter.builder().types(List.of("page")).build().apply(ALL)).containsExactly(PAGE);
        assertThat(LinkFilter.builder().types(List.of("zip")).build().apply(ALL)).containsExactly(EXT_ZIP);
    }

    @Test
    @DisplayName("확장자: 점/대소문자 무시, 경로 확장자 기준. 조건끼리는 AND")
    void extensionsAndCombination() {
        assertThat(LinkFilter.builder().extensions(List.of(".pdf", "ZIP")).build().apply(ALL)).containsExactly(PDF, EXT_ZIP);
        assertThat(LinkFilter.builder().internalOnly(true).extensions(List.of("zip")).build().apply(ALL)).isEmpty();
        assertThat(LinkFilter.builder().internalOnly(true).types(List.of("documents")).build().apply(ALL))
                .containsExactly(PDF);
    }

    @Test
    void emptyFilterKeepsResultAsIs() {
        LinkFilter none = LinkFilter.acceptAll();
        assertThat(none.isEmpty()).isTrue();
        CrawlResult r = new CrawlResult(CrawlState.DONE, "https://ex.com/", 1, 1, ALL, null, null, null);
        assertThat(none.apply(r)).isSameAs(r);

        CrawlResult filtered = LinkFilter.builder().internalOnly(true).build().apply(r);
        assertThat(filtered.getLinks()).containsExactly(PAGE, PDF);
        assertThat(filtered.getPagesCrawled()).isEqualTo(1);
    }

    @Test
    void fromConfigAndConflicts() {
        CrawlConfig.FilterCfg f = new CrawlConfig.FilterCfg().setSubdomainsOnly(true).setTypes(List.of("images"));
        assertThat(LinkFilter.fromConfig(f).apply(ALL)).containsExactly(IMG);

        assertThatThrownBy(() -> LinkFilter.builder().internalOnly(true).externalOnly(true).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("리포트 집계: 타입별/도메인별/검증")
    void reportCounts() {
        CrawlResult r = new CrawlResult(CrawlState.DONE, "https://ex.com/", 1, 1, ALL, null, null, null);
        CrawlReport rep = CrawlReport.of(r);
        assertThat(rep.count(LinkType.PAGE)).isEqualTo(1);
        assertThat(rep.count(LinkType.VIDEO)).isZero();
        assertThat(rep.internalLinks()).isEqualTo(2);
        assertThat(rep.subdomainLinks()).isEqualTo(1);
        assertThat(rep.externalLinks()).isEqualTo(2);
        assertThat(rep.validatedLinks()).isZero();
        assertThat(rep.info().filesFound()).isEqualTo(4);
    }
}
