package com.linkscout.core.model;

import java.util.Map;

/** CSS 셀렉터로 고른 요소 하나. href는 속성이 있을 때만(없으면 null) */
public record ElementData(String text, String html, Map<String, String> attributes, String href) {
    public ElementData {
        attributes = (attributes == null) ? Map.of() : attributes;
    }
}
