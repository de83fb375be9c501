package com.linkscout.core.util;

import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.FollowRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("클래스패스 샘플: 평면 키 + comments/filter/validation 섹션 매핑")
    void loadsAllSections() throws Exception {
        CrawlConfig cfg;
        try (InputStream in = getClass().getResourceAsStream("/crawl-sample.yml")) {
            assertThat(in).isNotNull();
            cfg = YamlConfigLoader.load(in);
        }

        assertThat(cfg.getTargetUri().toString()).isEqualTo("https://example.com/start");
        assertThat(cfg.getMaxDepth()).isEqualTo(3);
        assertThat(cfg.getMaxPages()).isEqualTo(20);
        assertThat(cfg.getFollowRule()).isEqualTo(FollowRule.INTERNAL_AND_SUBDOMAINS);
        assertThat(cfg.isIncludeSubdomains()).isTrue();
        assertThat(cfg.isAllowDuplicates()).isTrue();
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(cfg.getConcurrency()).isEqualTo(4);
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.isExtractMedia()).isTrue();
        assertThat(cfg.isExtractSrcset()).isTrue();
        assertThat(cfg.getHeaders()).containsEntry("Authorization", "Bearer abc").containsEntry("X-Trace", "7");
        assertThat(cfg.effectiveHeaders()).containsEntry("User-Agent", "LinkScoutTest/1.0");

        assertThat(cfg.getComments().isEnabled()).isTrue();
        assertThat(cfg.getComments().getType()).isEqualTo("javascript");
        assertThat(cfg.getComments().getMinLength()).isEqualTo(5);

        assertThat(cfg.getFilter().isInternalOnly()).isTrue();
        assertThat(cfg.getFilter().getTypes()).containsExactly("documents", "images");
        assertThat(cfg.getFilter().getExtensions()).containsExactly("pdf", ".zip");

        assertThat(cfg.getValidation().isEnabled()).isTrue();
        assertThat(cfg.getValidation().getRps()).isEqualTo(3);
    }

    @Test
    @DisplayName("없는 키는 기본값, headers는 JSON 문자열도 허용")
    void defaultsAndJsonHeaders() throws Exception {
        Path yml = tmp.resolve("crawl.yml");
        Files.writeString(yml, "target: https://ex.com\nheaders: '{\"Cookie\":\"sid=1\"}'\n", StandardCharsets.UTF_8);

        CrawlConfig cfg = YamlConfigLoader.load(yml);
        assertThat(cfg.getMaxDepth()).isEqualTo(2);
        assertThat(cfg.getMaxPages()).isEqualTo(50);
        assertThat(cfg.getFollowRule()).isEqualTo(FollowRule.INTERNAL_ONLY);
        assertThat(cfg.getConcurrency()).isEqualTo(2);
        assertThat(cfg.getHeaders()).containsEntry("Cookie", "sid=1");
        assertThat(cfg.getComments().isEnabled()).isFalse();
        assertThat(cfg.getFilter().isEmpty()).isTrue();
        assertThat(cfg.getValidation().getRps()).isEqualTo(10);
    }

    @Test
    void missingFile_throwsIOException() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("설정 오류: 모르는 followRule, target 누락, 잘못된 값")
    void configErrors() throws Exception {
        Path badRule = tmp.resolve("bad-rule.yml");
        Files.writeString(badRule, "target: https://ex.com\nfollowRule: everywhere\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(badRule))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("followRule");

        Path noTarget = tmp.resolve("no-target.yml");
        Files.writeString(noTarget, "maxDepth: 1\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(noTarget)).isInstanceOf(NullPointerException.class);

        Path badDepth = tmp.resolve("bad-depth.yml");
        Files.writeString(badDepth, "target: https://ex.com\nmaxDepth: -1\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(badDepth))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth");

        Path badTarget = tmp.resolve("bad-target.yml");
        Files.writeString(badTarget, "target: ftp://ex.com\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(badTarget)).isInstanceOf(InvalidUrlException.class);
    }
}
