package com.linkscout.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/** 페처 호출 인자. screenshot은 렌더링 모드에서만 쓰는 저장 경로(없으면 null) */
public record FetchRequest(URI url, Map<String, String> headers, Duration timeout, boolean renderJs, Path screenshot) {
    public FetchRequest {
        Objects.requireNonNull(url, "url");
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
        Objects.requireNonNull(timeout, "timeout");
    }

    public FetchRequest(URI url, Map<String, String> headers, Duration timeout, boolean renderJs) {
        this(url, headers, timeout, renderJs, null);
    }
}
