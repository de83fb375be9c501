package com.linkscout.core.util;

import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.FollowRule;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * maxDepth: 2
 * maxPages: 50
 * followRule: internal_only | internal_and_subdomains | all
 * includeSubdomains: false
 * allowDuplicates: false
 * timeoutMs: 10000
 * concurrency: 2
 * renderJs: false
 * followRedirects: true
 * userAgent: "..."
 * extractMedia: false
 * extractSrcset: false
 * screenshot: "page.png"        # 단일 페이지 모드 + renderJs
 * headers:                      # 맵 또는 JSON 객체 문자열
 *   Authorization: "Bearer x"
 *
 * comments:
 *   enabled: true
 *   type: javascript            # html | javascript | js_single | js_multi
 *   minLength: 10
 *
 * filter:
 *   internalOnly: true
 *   types: [documents, images]  # 또는 "documents,images"
 *   extensions: [pdf, zip]
 *
 * validation:
 *   enabled: true
 *   rps: 5
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 스트림에서 읽기(클래스패스 리소스 등). 스트림은 호출자가 닫는다 */
    public static CrawlConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지(target 없음 → validate 실패)
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setInt(map, "maxDepth", cfg::setMaxDepth);
        setInt(map, "maxPages", cfg::setMaxPages);
        setFollowRule(map, "followRule", cfg::setFollowRule);
        setBoolean(map, "includeSubdomains", cfg::setIncludeSubdomains);
        setBoolean(map, "allowDuplicates", cfg::setAllowDuplicates);
        setLong(map, "timeoutMs", cfg::setTimeoutMs);
        setInt(map, "concurrency", cfg::setConcurrency);
        setBoolean(map, "renderJs", cfg::setRenderJs);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "extractMedia", cfg::setExtractMedia);
        setBoolean(map, "extractSrcset", cfg::setExtractSrcset);
        setString(map, "screenshot", v -> cfg.setScreenshot(Path.of(v)));
        setHeaders(map, "headers", cfg::setHeaders);

        // 2) comments.*
        Map<String, Object> comments = getMap(map, "comments");
        if (comments != null) {
            var c = cfg.getComments();
            setBoolean(comments, "enabled", c::setEnabled);
            setString(comments, "type", c::setType);
            setInt(comments, "minLength", c::setMinLength);
        }

        // 3) filter.*
        Map<String, Object> filter = getMap(map, "filter");
        if (filter != null) {
            var f = cfg.getFilter();
            setBoolean(filter, "internalOnly", f::setInternalOnly);
            setBoolean(filter, "externalOnly", f::setExternalOnly);
            setBoolean(filter, "subdomainsOnly", f::setSubdomainsOnly);
            setStringList(filter, "types", f::setTypes);
            setStringList(filter, "extensions", f::setExtensions);
        }

        // 4) validation.*
        Map<String, Object> validation = getMap(map, "validation");
        if (validation != null) {
            var v = cfg.getValidation();
            setBoolean(validation, "enabled", v::setEnabled);
            setInt(validation, "rps", v::setRps);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    /** 맵이면 그대로, 문자열이면 JSON 객체로 해석 */
    private static void setHeaders(Map<?, ?> map, String key, Consumer<Map<String, String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Map<?, ?> m) {
            Map<String, String> out = new LinkedHashMap<>();
            m.forEach((k, val) -> { if (k != null && val != null) out.put(String.valueOf(k), String.valueOf(val)); });
            setter.accept(out);
        } else {
            setter.accept(HeaderParser.parseJson(String.valueOf(v)));
        }
    }

    /** internal_only / internal-only / INTERNAL_ONLY 모두 허용. 모르는 값은 설정 오류 */
    private static void setFollowRule(Map<?, ?> map, String key, Consumer<FollowRule> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            setter.accept(FollowRule.valueOf(s));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown followRule: " + v, e);
        }
    }
}
