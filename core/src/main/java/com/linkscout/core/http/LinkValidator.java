package com.linkscout.core.http;

import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.Link;
import com.linkscout.core.model.ValidationStatus;
import com.linkscout.core.util.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 링크 도달성 검사: 고유 resolvedUrl마다 HEAD 한 번(405/501이면 GET 한 번 더).
 * 링크를 지우지 않고 ValidationStatus만 붙인다. 어떤 실패도 예외로 올리지 않는다.
 */
public class LinkValidator {

    private static final Logger LOG = LoggerFactory.getLogger(LinkValidator.class);

    /** 테스트/모킹용 송신 훅: 요청 → 상태 코드 */
    @FunctionalInterface
    public interface StatusSender {
        int send(HttpRequest req) throws Exception;
    }

    private final Duration timeout;
    private final Map<String, String> headers;
    private final RateLimiter limiter;
    private final StatusSender sender;

    public LinkValidator(CrawlConfig config) {
        this(config, clientSender(config));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public LinkValidator(CrawlConfig config, StatusSender sender) {
        Objects.requireNonNull(config, "config");
        this.timeout = config.getTimeout();
        this.headers = config.effectiveHeaders();
        this.limiter = RateLimiter.perSecond(config.getValidation().getRps());
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static StatusSender clientSender(CrawlConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    /** 입력 순서·개수 그대로, 각 링크에 검증 결과를 붙인 사본 */
    public List<Link> validate(List<Link> links) {
        Map<String, ValidationStatus> cache = new HashMap<>();
        List<Link> out = new ArrayList<>(links.size());
        int checked = 0;
        for (Link l : links) {
            ValidationStatus st;
            if (!l.isCrawlable()) {
                st = ValidationStatus.notApplicable();
            } else {
                st = cache.get(l.getResolvedUrl());
                if (st == null) {
                    st = check(l.getResolvedUrl());
                    cache.put(l.getResolvedUrl(), st);
                    checked++;
                }
            }
            out.add(l.withValidation(st));
        }
        LOG.info("Validated {} links ({} unique requests)", links.size(), checked);
        return out;
    }

    /** 단일 URL 검사. 응답이 없으면 status 0 + error */
    public ValidationStatus check(String url) {
        if (Thread.currentThread().isInterrupted()) return ValidationStatus.unreachable("interrupted");
        try {
            limiter.acquire();
            URI uri = URI.create(url);
            int status = sender.send(request(uri, "HEAD"));
            if (status == 405 || status == 501) {
                // HEAD 미지원 서버
                limiter.acquire();
                status = sender.send(request(uri, "GET"));
            }
            LOG.debug("Validate {} -> {}", url, status);
            return ValidationStatus.ofStatus(status);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ValidationStatus.unreachable("interrupted");
        } catch (HttpTimeoutException e) {
            return ValidationStatus.unreachable("timeout");
        } catch (Exception e) {
            LOG.debug("Validate {} failed: {}", url, e.toString());
            String msg = (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage();
            return ValidationStatus.unreachable(msg);
        }
    }

    private HttpRequest request(URI uri, String method) {
        HttpRequest.Builder b = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .method(method, HttpRequest.BodyPublishers.noBody());
        headers.forEach((k, v) -> {
            try {
                b.header(k, v);
            } catch (IllegalArgumentException e) { // Host, Connection 등 HttpClient 제한 헤더
                LOG.debug("Skip restricted header {}: {}", k, e.getMessage());
            }
        });
        return b.build();
    }
}
