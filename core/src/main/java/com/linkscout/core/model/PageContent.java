package com.linkscout.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * 단일 페이지 본문 요약.
 * contentPreview: 본문 텍스트 앞 500자(넘치면 "..." 붙임). screenshot: 저장된 경우만.
 */
public record PageContent(String url, String title, int statusCode, int textLength,
                          String contentPreview, List<PageComment> comments, Path screenshot) {
    public PageContent {
        comments = (comments == null) ? List.of() : List.copyOf(comments);
    }
}
