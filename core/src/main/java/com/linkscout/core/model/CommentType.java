package com.linkscout.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum CommentType {
    HTML("html"),
    JAVASCRIPT_SINGLE("javascript_single"),
    JAVASCRIPT_MULTI("javascript_multi");

    private final String label;

    CommentType(String label) { this.label = label; }

    public String label() { return label; }

    /**
     * 주석 타입 필터 문자열 해석.
     * html | javascript | js_single | js_multi | 라벨 그대로. null/빈값이면 전체.
     */
    public static Set<CommentType> parseFilter(String s) {
        if (s == null || s.isBlank()) return EnumSet.allOf(CommentType.class);
        String k = s.trim().toLowerCase(Locale.ROOT);
        switch (k) {
            case "javascript": return EnumSet.of(JAVASCRIPT_SINGLE, JAVASCRIPT_MULTI);
            case "js_single":  return EnumSet.of(JAVASCRIPT_SINGLE);
            case "js_multi":   return EnumSet.of(JAVASCRIPT_MULTI);
            default:
                for (CommentType t : values()) {
                    if (t.label.equals(k)) return EnumSet.of(t);
                }
                throw new IllegalArgumentException("unknown comment type: " + s);
        }
    }
}
