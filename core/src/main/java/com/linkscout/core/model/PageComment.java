package com.linkscout.core.model;

/**
 * 페이지에서 추출한 HTML/JS 주석.
 * lineStart는 스캔한 텍스트 기준 1부터, position은 문자 오프셋.
 * location: "html" | "inline_script"
 */
public record PageComment(CommentType type, String content, int lineStart, int position, String location) {}
