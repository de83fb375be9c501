package com.linkscout.core.crawler;

import com.linkscout.core.api.ICrawler;
import com.linkscout.core.api.IPageFetcher;
import com.linkscout.core.http.FetchException;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlError;
import com.linkscout.core.model.CrawlPhase;
import com.linkscout.core.model.CrawlResult;
import com.linkscout.core.model.CrawlState;
import com.linkscout.core.model.ErrorKind;
import com.linkscout.core.model.FetchRequest;
import com.linkscout.core.model.FrontierEntry;
import com.linkscout.core.model.Link;
import com.linkscout.core.model.PageComment;
import com.linkscout.core.model.PageFetchResult;
import com.linkscout.core.model.PageInfo;
import com.linkscout.core.model.SeedRequest;
import com.linkscout.core.util.DomainScope;
import com.linkscout.core.util.LinkTypes;
import com.linkscout.core.util.ProgressListener;
import com.linkscout.core.util.StructuredLog;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BFS 크롤 스케줄러
 * - 레벨 단위 진행: 깊이 d의 페치가 모두 끝난 뒤에 d+1 페치 시작
 * - 페이지 예산은 페치 직전에 원자적으로 예약(실패한 페치도 1장)
 * - 같은 레벨 페이지는 고정 스레드풀(concurrency)에서 병렬로 가져오고 추출
 * - 결과 병합/프론티어 추가는 코디네이터 스레드 한 곳에서 제출 순서대로
 * - 페이지 실패는 CrawlError로 남기고 계속. 시드 실패만 FAILED
 */
public class CrawlScheduler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlScheduler.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlScheduler.class);

    private final CrawlConfig config;
    private final SeedRequest seed;
    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;
    private final CommentExtractor comments;   // null이면 주석 추출 안 함
    private final ProgressListener listener;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile CrawlPhase phase = CrawlPhase.IDLE;

    public CrawlScheduler(CrawlConfig config, IPageFetcher fetcher) {
        this(config, fetcher, null, ProgressListener.NONE);
    }

    /** DI/테스트용. extractor가 null이면 설정 기반 JsoupLinkExtractor */
    public CrawlScheduler(CrawlConfig config, IPageFetcher fetcher, LinkExtractor extractor, ProgressListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.seed = SeedRequest.from(config);
        DomainScope scope = DomainScope.of(seed.startUrl(), config.isIncludeSubdomains());
        this.extractor = (extractor != null)
                ? extractor
                : new JsoupLinkExtractor(scope, config.isExtractMedia(), config.isExtractSrcset());
        this.comments = CommentExtractor.fromConfig(config.getComments());
        this.listener = (listener != null) ? listener : ProgressListener.NONE;
    }

    public CrawlPhase getPhase() { return phase; }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("Crawl cancel requested: {}", seed.startUrl());
        }
    }

    @Override
    public CrawlResult crawl() {
        return crawl(null);
    }

    /** 외부 취소 플래그(옵션). cancel()과 같은 효과 */
    public CrawlResult crawl(AtomicBoolean cancelFlag) {
        final int cc = Math.max(1, config.getConcurrency());
        final int maxDepth = seed.maxDepth();
        final URI start = seed.startUrl();

        LOG.info("Crawl start: seed={}, maxDepth={}, maxPages={}, cc={}, follow={}",
                start, maxDepth, seed.maxPages(), cc, seed.followRule());
        SLOG.info("crawl-start",
                "seed", start.toString(),
                "maxDepth", maxDepth,
                "maxPages", seed.maxPages(),
                "cc", cc,
                "renderJs", config.isRenderJs());

        final Frontier frontier = new Frontier();
        final LinkDeduplicator dedup = new LinkDeduplicator(config.isAllowDuplicates());
        final AtomicInteger budget = new AtomicInteger(seed.maxPages());

        final List<Link> links = new ArrayList<>();
        final List<PageInfo> pages = new ArrayList<>();
        final List<CrawlError> errors = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        int attempted = 0;
        boolean seedFailed = false;
        boolean budgetHit = false;
        int unfetched = 0;
        boolean warnedFallback = false;

        frontier.offer(start, 0);

        // 고정 스레드풀(+역압)
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("crawl-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        try {
            while (!frontier.isEmpty() && !isCancelled(cancelFlag) && !budgetHit) {
                List<FrontierEntry> level = frontier.pollLevel();

                // ---- 1) 예산 예약 후 제출 ----
                setPhase(CrawlPhase.FETCHING, attempted, frontier);
                List<FrontierEntry> submitted = new ArrayList<>(level.size());
                List<Future<PageOutcome>> futures = new ArrayList<>(level.size());
                for (FrontierEntry entry : level) {
                    if (isCancelled(cancelFlag)) break;
                    if (!tryReserve(budget)) {
                        budgetHit = true;
                        unfetched = level.size() - submitted.size();
                        break;
                    }
                    submitted.add(entry);
                    futures.add(exec.submit(() -> process(entry, cancelFlag)));
                }

                // ---- 2) 레벨 전체 수거 후 리다이렉트 최종 URL부터 방문 처리 ----
                setPhase(CrawlPhase.EXTRACTING, attempted, frontier);
                List<PageOutcome> outcomes = new ArrayList<>(futures.size());
                for (int i = 0; i < futures.size(); i++) {
                    outcomes.add(await(futures.get(i), submitted.get(i)));
                }
                for (PageOutcome o : outcomes) {
                    // 같은 레벨의 앞 페이지가 이 URL을 다음 깊이로 넣지 못하게
                    if (!o.skipped() && o.error() == null) frontier.markVisited(o.fetched().getFinalUrl());
                }

                // ---- 3) 제출 순서대로 병합 ----
                for (int i = 0; i < outcomes.size(); i++) {
                    FrontierEntry entry = submitted.get(i);
                    PageOutcome o = outcomes.get(i);
                    if (o.skipped()) continue;

                    attempted++;
                    setPhase(CrawlPhase.ENQUEUING, attempted, frontier);

                    if (o.error() != null) {
                        errors.add(o.error());
                        if (entry.depth() == 0) seedFailed = true;
                        LOG.warn("Fetch failed: {} ({} {})", o.error().url(), o.error().kind(), o.error().message());
                        SLOG.warn("page-failed",
                                "url", o.error().url(),
                                "depth", entry.depth(),
                                "kind", o.error().kind().name(),
                                "status", o.error().status());
                        continue;
                    }

                    PageFetchResult fetched = o.fetched();
                    URI finalUrl = fetched.getFinalUrl();

                    if (fetched.isJsFallback() && !warnedFallback) {
                        warnings.add("JS rendering unavailable; pages were fetched with plain HTTP");
                        warnedFallback = true;
                    }

                    pages.add(PageInfo.summarize(entry, fetched, o.title(), o.links(), o.comments()));

                    int enqueued = 0;
                    for (Link l : o.links()) {
                        Link kept = dedup.accept(l);
                        if (kept != null) links.add(kept);

                        if (shouldFollow(l, entry.depth(), maxDepth)
                                && frontier.offer(URI.create(l.getResolvedUrl()), entry.depth() + 1)) {
                            enqueued++;
                        }
                    }

                    LOG.info("Crawled {} (depth {}, page #{}) -> links={}, enqueued={}",
                            finalUrl, entry.depth(), attempted, o.links().size(), enqueued);
                    SLOG.info("page-crawled",
                            "url", finalUrl.toString(),
                            "depth", entry.depth(),
                            "pageNo", attempted,
                            "links", o.links().size(),
                            "enqueued", enqueued);
                }
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        CrawlState state;
        if (seedFailed) state = CrawlState.FAILED;
        else if (isCancelled(cancelFlag)) state = CrawlState.CANCELLED;
        else state = CrawlState.DONE;

        if (budgetHit) {
            warnings.add("Page limit reached (" + seed.maxPages() + "); "
                    + (unfetched + frontier.size()) + " queued URLs not fetched");
        }
        setPhase(state == CrawlState.FAILED ? CrawlPhase.FAILED : CrawlPhase.DONE, attempted, frontier);

        LOG.info("Crawl done: state={}, pages={}, links={}, errors={}", state, attempted, links.size(), errors.size());
        SLOG.info("crawl-done",
                "state", state.name(),
                "pages", attempted,
                "links", links.size(),
                "uniqueLinks", dedup.uniqueCount(),
                "errors", errors.size());

        return new CrawlResult(state, start.toString(), maxDepth, attempted, links, pages, errors, warnings);
    }

    /* =========================
       워커 측
       ========================= */

    /** 워커 스레드에서 실행: 페치 + 파싱 + 추출. 예외를 밖으로 던지지 않는다 */
    private PageOutcome process(FrontierEntry entry, AtomicBoolean cancelFlag) {
        if (isCancelled(cancelFlag)) return PageOutcome.skip(entry);

        String url = entry.url().toString();
        FetchRequest req = new FetchRequest(entry.url(), seed.headers(), config.getTimeout(), config.isRenderJs());
        try {
            PageFetchResult fetched = fetcher.fetch(req);
            Document doc = fetched.toDocument();
            if (doc == null) {
                return PageOutcome.fail(entry, CrawlError.of(url, entry.depth(), ErrorKind.PARSE_ERROR, "empty response body"));
            }
            List<Link> found = extractor.extract(doc, fetched.getFinalUrl());
            List<PageComment> cs = (comments == null) ? List.of() : comments.extract(fetched.rawHtml(), doc);
            return PageOutcome.ok(entry, fetched, doc.title(), found, cs);
        } catch (FetchException e) {
            return PageOutcome.fail(entry, new CrawlError(url, entry.depth(), e.getKind(), e.getStatus(), e.getMessage()));
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure on {}: {}", url, e.toString());
            SLOG.error("page-unexpected", e, "url", url);
            return PageOutcome.fail(entry, CrawlError.of(url, entry.depth(), ErrorKind.UNEXPECTED, e.toString()));
        }
    }

    /* =========================
       코디네이터 측
       ========================= */

    private boolean shouldFollow(Link l, int depth, int maxDepth) {
        if (depth >= maxDepth) return false;              // depth(child) = depth + 1 <= maxDepth
        if (!l.isCrawlable()) return false;               // mailto/tel/javascript/data
        if (!seed.followRule().follows(l)) return false;
        return LinkTypes.isCrawlablePage(URI.create(l.getResolvedUrl())); // pdf/이미지 등은 가져오지 않음
    }

    private PageOutcome await(Future<PageOutcome> f, FrontierEntry entry) {
        String url = entry.url().toString();
        try {
            return f.get(); // 각 페치는 FetchRequest timeout으로 보호됨
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            LOG.warn("Crawl task failed: {}", cause.toString());
            return PageOutcome.fail(entry, CrawlError.of(url, entry.depth(), ErrorKind.UNEXPECTED, cause.toString()));
        } catch (CancellationException ce) {
            return PageOutcome.skip(entry);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancel();
            return PageOutcome.skip(entry);
        }
    }

    /** 남은 예산이 있으면 1 차감. 확인과 차감이 한 번의 CAS */
    private static boolean tryReserve(AtomicInteger budget) {
        for (;;) {
            int left = budget.get();
            if (left <= 0) return false;
            if (budget.compareAndSet(left, left - 1)) return true;
        }
    }

    private boolean isCancelled(AtomicBoolean flag) {
        return cancelled.get() || (flag != null && flag.get());
    }

    private void setPhase(CrawlPhase p, int done, Frontier frontier) {
        this.phase = p;
        try {
            listener.onProgress(p, done, seed.maxPages(), frontier.size());
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    /** 워커 → 코디네이터 전달용. skipped = 취소로 페치하지 않음 */
    private record PageOutcome(FrontierEntry entry, PageFetchResult fetched, String title,
                               List<Link> links, List<PageComment> comments, CrawlError error, boolean skipped) {
        static PageOutcome ok(FrontierEntry e, PageFetchResult r, String title, List<Link> links, List<PageComment> cs) {
            return new PageOutcome(e, r, title, links, cs, null, false);
        }
        static PageOutcome fail(FrontierEntry e, CrawlError err) {
            return new PageOutcome(e, null, null, List.of(), List.of(), err, false);
        }
        static PageOutcome skip(FrontierEntry e) {
            return new PageOutcome(e, null, null, List.of(), List.of(), null, true);
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
