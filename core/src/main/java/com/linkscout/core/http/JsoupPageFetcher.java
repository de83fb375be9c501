package com.linkscout.core.http;

import com.linkscout.core.api.IPageFetcher;
import com.linkscout.core.model.ErrorKind;
import com.linkscout.core.model.FetchRequest;
import com.linkscout.core.model.PageFetchResult;
import com.linkscout.core.util.UrlUtils;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Objects;

/** 기본 JSoup 기반 페처: GET → 원문 HTML + 리다이렉트 후 최종 URL */
public class JsoupPageFetcher implements IPageFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final boolean followRedirects;

    public JsoupPageFetcher() {
        this(true);
    }

    public JsoupPageFetcher(boolean followRedirects) {
        this.followRedirects = followRedirects;
    }

    @Override
    public PageFetchResult fetch(FetchRequest req) throws FetchException {
        Objects.requireNonNull(req, "req");
        String url = req.url().toString();
        // jsoup timeout은 int 필요 → 안전 캐스팅
        long ms = Math.max(1, Math.min(Integer.MAX_VALUE, req.timeout().toMillis()));
        long t0 = System.nanoTime();
        try {
            Connection conn = Jsoup.connect(url)
                    .timeout((int) ms)
                    .followRedirects(followRedirects)
                    .ignoreHttpErrors(false);
            req.headers().forEach(conn::header);

            Connection.Response resp = conn.execute();
            URI finalUrl = UrlUtils.normalize(resp.url().toURI());
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
            LOG.debug("Fetched {} -> {} ({}), {}ms", url, finalUrl, resp.statusCode(), elapsedMs);

            return PageFetchResult.builder()
                    .requestedUrl(req.url())
                    .finalUrl(finalUrl)
                    .status(resp.statusCode())
                    .html(resp.body())
                    .elapsedMs(elapsedMs)
                    .build();
        } catch (HttpStatusException e) {
            throw new FetchException(ErrorKind.HTTP_ERROR, e.getStatusCode(), "HTTP " + e.getStatusCode() + " for " + url, e);
        } catch (UnsupportedMimeTypeException e) {
            throw new FetchException(ErrorKind.PARSE_ERROR, "Not an HTML page (" + e.getMimeType() + "): " + url, e);
        } catch (UnknownHostException e) {
            throw new FetchException(ErrorKind.DNS_FAILURE, "Unknown host: " + e.getMessage(), e);
        } catch (SocketTimeoutException e) {
            throw new FetchException(ErrorKind.TIMEOUT, "Timed out after " + ms + "ms: " + url, e);
        } catch (ConnectException e) {
            throw new FetchException(ErrorKind.CONNECTION_REFUSED, "Connection refused: " + url, e);
        } catch (IOException e) {
            throw new FetchException(ErrorKind.IO, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new FetchException(ErrorKind.INVALID_URL, "Invalid URL: " + url, e);
        }
    }
}
