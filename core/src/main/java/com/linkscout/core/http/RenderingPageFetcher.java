package com.linkscout.core.http;

import com.linkscout.core.api.IPageFetcher;
import com.linkscout.core.model.ErrorKind;
import com.linkscout.core.model.FetchRequest;
import com.linkscout.core.model.PageFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * renderJs 요청은 렌더러로, 그 외는 일반 페처로.
 * 렌더러가 없거나 렌더링이 실패하면 일반 HTTP로 대체하고 jsFallback=true 를 붙인다.
 * 렌더링 모드에서 사용자 헤더는 전달되지 않는다(경고 1회).
 */
public class RenderingPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RenderingPageFetcher.class);

    /** 대상 자체의 문제라 일반 HTTP로 다시 가져와도 소용없는 실패 */
    private static final Set<ErrorKind> TARGET_FAILURES =
            EnumSet.of(ErrorKind.HTTP_ERROR, ErrorKind.DNS_FAILURE, ErrorKind.CONNECTION_REFUSED);

    private final IPageFetcher plain;
    private final JsRenderer renderer;
    private final AtomicBoolean warnedUnavailable = new AtomicBoolean();
    private final AtomicBoolean warnedHeaders = new AtomicBoolean();

    public RenderingPageFetcher(IPageFetcher plain, JsRenderer renderer) {
        this.plain = Objects.requireNonNull(plain, "plain");
        this.renderer = renderer; // null이면 항상 대체
    }

    @Override
    public PageFetchResult fetch(FetchRequest req) throws FetchException {
        if (!req.renderJs()) return plain.fetch(req);

        if (renderer == null || !renderer.isAvailable()) {
            if (warnedUnavailable.compareAndSet(false, true)) {
                LOG.warn("JS rendering requested but no renderer is available; falling back to plain HTTP");
            }
            return fallback(req);
        }

        if (hasCustomHeaders(req) && warnedHeaders.compareAndSet(false, true)) {
            LOG.warn("Custom headers are not sent in JS rendering mode");
        }

        try {
            return renderer.render(req);
        } catch (FetchException e) {
            if (TARGET_FAILURES.contains(e.getKind())) throw e;
            LOG.warn("Render failed for {} ({}: {}); falling back to plain HTTP",
                    req.url(), e.getKind(), e.getMessage());
            return fallback(req);
        }
    }

    private PageFetchResult fallback(FetchRequest req) throws FetchException {
        return plain.fetch(req).toBuilder().jsFallback(true).build();
    }

    private static boolean hasCustomHeaders(FetchRequest req) {
        for (String k : req.headers().keySet()) {
            if (!"User-Agent".equalsIgnoreCase(k)) return true;
        }
        return false;
    }

    @Override
    public void close() {
        try {
            if (renderer != null) renderer.close();
        } finally {
            plain.close();
        }
    }
}
