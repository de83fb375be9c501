package com.linkscout.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final ObjectMapper om = new ObjectMapper();
    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    @DisplayName("한 줄 JSON: 공통 필드 + key/value 타입 유지")
    void rendersJsonLine() throws Exception {
        String line = slog.render("INFO", "crawl.page", null,
                "url", "https://ex.com/a", "depth", 1, "ms", 15L, "ok", true, "missing", null);
        assertThat(line).doesNotContain("\n");

        JsonNode n = om.readTree(line);
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("event").asText()).isEqualTo("crawl.page");
        assertThat(n.get("ts").asText()).isNotBlank();
        assertThat(n.get("url").asText()).isEqualTo("https://ex.com/a");
        assertThat(n.get("depth").isInt()).isTrue();
        assertThat(n.get("ms").asLong()).isEqualTo(15L);
        assertThat(n.get("ok").asBoolean()).isTrue();
        assertThat(n.get("missing").isNull()).isTrue();
        assertThat(n.has("_kv_mismatch")).isFalse();
    }

    @Test
    @DisplayName("홀수 개 kv는 _kv_mismatch, 예외는 error/message")
    void mismatchAndError() throws Exception {
        String line = slog.render("ERROR", "fetch.fail", new IllegalStateException("boom \"quoted\""),
                "url", "https://ex.com", "dangling");
        JsonNode n = om.readTree(line);
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("boom \"quoted\"");
        assertThat(n.has("dangling")).isFalse();
    }
}
