package com.linkscout.core.model;

import java.net.URI;
import java.util.Objects;

/** 가져올 (url, depth) 한 쌍 */
public record FrontierEntry(URI url, int depth) {
    public FrontierEntry {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }
}
