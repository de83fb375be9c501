package com.linkscout.core.http;

import com.linkscout.core.model.ErrorKind;
import com.linkscout.core.model.FetchRequest;
import com.linkscout.core.model.PageFetchResult;
import com.linkscout.core.util.UrlUtils;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;

/**
 * Playwright(Chromium) 렌더러.
 * 브라우저는 첫 사용 시 한 번만 띄우고, 페이지마다 새 컨텍스트를 연다.
 * 드라이버/브라우저를 띄우지 못하면 이후 isAvailable()=false 로 고정.
 */
public final class PlaywrightRenderer implements JsRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightRenderer.class);

    private final boolean headless;
    private Playwright playwright;
    private Browser browser;
    private boolean initFailed;

    public PlaywrightRenderer() {
        this(true);
    }

    public PlaywrightRenderer(boolean headless) {
        this.headless = headless;
    }

    @Override
    public synchronized boolean isAvailable() {
        return ensureBrowser() != null;
    }

    private Browser ensureBrowser() {
        if (browser != null) return browser;
        if (initFailed) return null;
        try {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            LOG.info("Playwright chromium launched (headless={})", headless);
            return browser;
        } catch (RuntimeException e) { // PlaywrightException + 드라이버 설치 실패
            LOG.warn("JS rendering unavailable: {}", e.getMessage());
            initFailed = true;
            close();
            return null;
        }
    }

    @Override
    public synchronized PageFetchResult render(FetchRequest req) throws FetchException {
        Browser b = ensureBrowser();
        if (b == null) throw new FetchException(ErrorKind.UNEXPECTED, "JS renderer is not available");

        String url = req.url().toString();
        double ms = (double) Math.max(1, req.timeout().toMillis());
        long t0 = System.nanoTime();
        BrowserContext ctx = b.newContext();
        try {
            Page page = ctx.newPage();
            page.setDefaultNavigationTimeout(ms);
            Response resp = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout(ms));
            int status = (resp == null) ? 200 : resp.status(); // about:blank 등은 응답 없음
            if (status >= 400) throw FetchException.httpStatus(status, url);

            String html = page.content();
            URI finalUrl = UrlUtils.normalize(URI.create(page.url()));
            return PageFetchResult.builder()
                    .requestedUrl(req.url())
                    .finalUrl(finalUrl)
                    .status(status)
                    .html(html)
                    .elapsedMs((System.nanoTime() - t0) / 1_000_000)
                    .screenshot(takeScreenshot(page, req.screenshot()))
                    .build();
        } catch (TimeoutError e) {
            throw new FetchException(ErrorKind.TIMEOUT, "Render timed out: " + url, e);
        } catch (PlaywrightException e) {
            throw new FetchException(ErrorKind.IO, "Render failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new FetchException(ErrorKind.INVALID_URL, "Invalid final URL after render: " + url, e);
        } finally {
            ctx.close();
        }
    }

    /** 전체 페이지 PNG. 실패해도 페이지 결과는 살린다(경고만) */
    private static Path takeScreenshot(Page page, Path target) {
        if (target == null) return null;
        try {
            page.screenshot(new Page.ScreenshotOptions().setPath(target).setFullPage(true));
            LOG.info("Screenshot saved: {}", target);
            return target;
        } catch (PlaywrightException e) {
            LOG.warn("Could not take screenshot {}: {}", target, e.getMessage());
            return null;
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (browser != null) browser.close();
        } catch (PlaywrightException e) {
            LOG.debug("browser close failed: {}", e.getMessage());
        } finally {
            browser = null;
        }
        try {
            if (playwright != null) playwright.close();
        } catch (PlaywrightException e) {
            LOG.debug("playwright close failed: {}", e.getMessage());
        } finally {
            playwright = null;
        }
    }
}
