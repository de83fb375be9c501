package com.linkscout.core.service;

import com.linkscout.core.api.IPageFetcher;
import com.linkscout.core.crawler.CommentExtractor;
import com.linkscout.core.crawler.CrawlScheduler;
import com.linkscout.core.crawler.PageContentExtractor;
import com.linkscout.core.crawler.RuleExtractor;
import com.linkscout.core.http.FetchException;
import com.linkscout.core.http.JsoupPageFetcher;
import com.linkscout.core.http.LinkValidator;
import com.linkscout.core.http.PlaywrightRenderer;
import com.linkscout.core.http.RenderingPageFetcher;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlResult;
import com.linkscout.core.model.ElementData;
import com.linkscout.core.model.ErrorKind;
import com.linkscout.core.model.FetchRequest;
import com.linkscout.core.model.PageContent;
import com.linkscout.core.model.PageFetchResult;
import com.linkscout.core.util.ProgressListener;
import com.linkscout.core.util.StructuredLog;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 크롤 오케스트레이터:
 *  - validate → crawl → filter → (옵션) 링크 검증 → 리포트
 *  - 기본 페처(JsoupPageFetcher, renderJs면 Playwright + 대체 경로)
 *  - DI 생성자는 테스트/플러그인 주입용
 *  - 단일 페이지 모드: extractStructured(규칙), extractElements(셀렉터), extractContent(본문 요약)
 */
public final class CrawlService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final boolean ownsFetcher;
    private LinkValidator validator;   // validation.enabled일 때 지연 생성

    private volatile CrawlScheduler current;

    /** 기본 구현 */
    public CrawlService(CrawlConfig config) {
        this(config, defaultFetcher(Objects.requireNonNull(config, "config")), null, true);
    }

    /** DI/테스트/플러그인용. validator가 null이면 필요할 때 HttpClient 기반으로 생성 */
    public CrawlService(CrawlConfig config, IPageFetcher fetcher, LinkValidator validator) {
        this(config, fetcher, validator, false);
    }

    private CrawlService(CrawlConfig config, IPageFetcher fetcher, LinkValidator validator, boolean ownsFetcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate(); // 설정 오류는 어떤 요청보다 먼저
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.validator = validator;
        this.ownsFetcher = ownsFetcher;
    }

    static IPageFetcher defaultFetcher(CrawlConfig config) {
        IPageFetcher plain = new JsoupPageFetcher(config.isFollowRedirects());
        return config.isRenderJs() ? new RenderingPageFetcher(plain, new PlaywrightRenderer()) : plain;
    }

    /* =========================
       실행 API (오버로드 3종)
       ========================= */

    public CrawlReport run() {
        return run(ProgressListener.NONE, null);
    }

    public CrawlReport run(ProgressListener listener) {
        return run(listener, null);
    }

    /** 진행률 + 취소 플래그(옵션). 취소되어도 그때까지의 결과를 돌려준다 */
    public CrawlReport run(ProgressListener listener, AtomicBoolean cancelFlag) {
        CrawlScheduler scheduler = new CrawlScheduler(config, fetcher, null, listener);
        current = scheduler;
        CrawlResult result;
        try {
            result = scheduler.crawl(cancelFlag);
        } finally {
            current = null;
        }

        // ---- 필터 ----
        LinkFilter filter = LinkFilter.fromConfig(config.getFilter());
        if (!filter.isEmpty()) {
            int before = result.getLinks().size();
            result = filter.apply(result);
            LOG.info("Filter applied: {} -> {} links", before, result.getLinks().size());
        }

        // ---- 링크 검증 ----
        if (config.getValidation().isEnabled() && !result.getLinks().isEmpty()) {
            result = result.withLinks(validator().validate(result.getLinks()));
        }

        CrawlReport report = CrawlReport.of(result);
        LOG.info("Crawl report: state={}, pages={}, links={}, files={}, errors={}",
                result.getState(), report.info().pagesCrawled(), report.info().totalLinks(),
                report.info().filesFound(), result.getErrors().size());
        SLOG.info("crawl-report",
                "state", result.getState().name(),
                "pages", report.info().pagesCrawled(),
                "links", report.info().totalLinks(),
                "files", report.info().filesFound(),
                "internal", report.internalLinks(),
                "subdomain", report.subdomainLinks(),
                "external", report.externalLinks(),
                "accessible", report.accessibleLinks());
        return report;
    }

    /** 실행 중인 크롤에 취소 요청 */
    public void cancel() {
        CrawlScheduler s = current;
        if (s != null) s.cancel();
    }

    /** 시드 페이지 한 장을 가져와 규칙대로 필드 추출 */
    public Map<String, Object> extractStructured(RuleExtractor rules) throws FetchException {
        Objects.requireNonNull(rules, "rules");
        PageFetchResult page = fetchSinglePage();
        Map<String, Object> out = rules.extract(parse(page));
        SLOG.info("extract-done", "url", page.getFinalUrl().toString(), "fields", out.size());
        return out;
    }

    /** 시드 페이지에서 셀렉터에 걸린 요소들. 잘못된 셀렉터는 IllegalArgumentException */
    public List<ElementData> extractElements(String selector) throws FetchException {
        PageFetchResult page = fetchSinglePage();
        List<ElementData> out = PageContentExtractor.select(parse(page), selector);
        SLOG.info("select-done", "url", page.getFinalUrl().toString(), "selector", selector, "elements", out.size());
        return out;
    }

    /** 시드 페이지 본문 요약(제목, 상태, 길이, 미리보기, comments.enabled면 주석) */
    public PageContent extractContent() throws FetchException {
        PageFetchResult page = fetchSinglePage();
        PageContent out = PageContentExtractor.summarize(page, parse(page),
                CommentExtractor.fromConfig(config.getComments()));
        LOG.info("Content extracted: {} (status {}, {} chars, {} comments)",
                out.url(), out.statusCode(), out.textLength(), out.comments().size());
        return out;
    }

    private PageFetchResult fetchSinglePage() throws FetchException {
        Path shot = config.getScreenshot();
        if (shot != null && !config.isRenderJs()) {
            LOG.warn("Screenshots require JS rendering; {} not written", shot);
            shot = null;
        }
        FetchRequest req = new FetchRequest(config.getTargetUri(), config.effectiveHeaders(),
                config.getTimeout(), config.isRenderJs(), shot);
        PageFetchResult page = fetcher.fetch(req);
        if (page.isJsFallback()) LOG.warn("JS rendering unavailable; {} was fetched with plain HTTP", req.url());
        return page;
    }

    private static Document parse(PageFetchResult page) throws FetchException {
        Document doc = page.toDocument();
        if (doc == null) throw new FetchException(ErrorKind.PARSE_ERROR, "empty response body: " + page.getRequestedUrl());
        return doc;
    }

    private synchronized LinkValidator validator() {
        if (validator == null) validator = new LinkValidator(config);
        return validator;
    }

    @Override
    public void close() {
        if (ownsFetcher) fetcher.close();
    }
}
