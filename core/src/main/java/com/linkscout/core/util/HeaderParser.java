package com.linkscout.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** 요청 헤더를 JSON 객체 문자열로 받을 때 사용. 예) {"Authorization":"Bearer x"} */
public final class HeaderParser {
    private HeaderParser(){}

    private static final ObjectMapper OM = new ObjectMapper();

    /**
     * JSON 객체 → 헤더 맵(입력 순서 유지). 값은 문자열로 변환.
     * null/빈 문자열이면 빈 맵, 객체가 아니거나 깨진 JSON이면 IllegalArgumentException.
     */
    public static Map<String, String> parseJson(String json) {
        Map<String, String> out = new LinkedHashMap<>();
        if (json == null || json.isBlank()) return out;
        JsonNode root;
        try {
            root = OM.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON for headers: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("headers must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (v == null || v.isNull()) continue;
            out.put(e.getKey(), v.isValueNode() ? v.asText() : v.toString());
        }
        return out;
    }
}
