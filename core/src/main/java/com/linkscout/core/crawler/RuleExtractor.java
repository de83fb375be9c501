package com.linkscout.core.crawler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CSS 셀렉터 규칙 기반 구조화 추출.
 *
 * rules.json 예:
 * {
 *   "title": {"selector": "h1", "attribute": "text"},
 *   "image": {"selector": "img.product", "attribute": "src"},
 *   "items": {"selector": ".item", "all": true}
 * }
 * attribute 생략 시 "text". all=true 면 리스트, 아니면 첫 요소 값(없으면 null).
 */
public final class RuleExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(RuleExtractor.class);

    private static final ObjectMapper OM = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Rule(String selector, String attribute, boolean all) {
        public Rule {
            attribute = (attribute == null || attribute.isBlank()) ? "text" : attribute;
        }
    }

    private final Map<String, Rule> rules;

    public RuleExtractor(Map<String, Rule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(rules, "rules")));
    }

    public static RuleExtractor fromJson(String json) throws IOException {
        return new RuleExtractor(OM.readValue(json, new TypeReference<LinkedHashMap<String, Rule>>() {}));
    }

    public static RuleExtractor fromFile(Path file) throws IOException {
        return new RuleExtractor(OM.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Rule>>() {}));
    }

    public Map<String, Rule> rules() { return rules; }

    /** 필드 순서 유지. selector가 없는 규칙은 건너뛴다 */
    public Map<String, Object> extract(Document doc) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Rule> e : rules.entrySet()) {
            Rule r = e.getValue();
            if (r == null || r.selector() == null || r.selector().isBlank()) continue;

            Elements found;
            try {
                found = doc.select(r.selector());
            } catch (Selector.SelectorParseException | IllegalArgumentException ex) { // 괄호 불균형은 ValidationException
                LOG.warn("Invalid selector for field {}: {}", e.getKey(), ex.getMessage());
                out.put(e.getKey(), null);
                continue;
            }

            if (r.all()) {
                List<String> values = new ArrayList<>(found.size());
                for (Element el : found) values.add(valueOf(el, r.attribute()));
                out.put(e.getKey(), values);
            } else {
                out.put(e.getKey(), found.isEmpty() ? null : valueOf(found.first(), r.attribute()));
            }
        }
        return out;
    }

    private static String valueOf(Element el, String attribute) {
        if ("text".equals(attribute)) return el.text().trim();
        return el.attr(attribute); // 없으면 ""
    }
}
