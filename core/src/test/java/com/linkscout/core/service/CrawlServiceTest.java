package com.linkscout.core.service;

import com.linkscout.core.api.IPageFetcher;
import com.linkscout.core.crawler.RuleExtractor;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.CrawlState;
import com.linkscout.core.model.ElementData;
import com.linkscout.core.model.ErrorKind;
import com.linkscout.core.model.FetchRequest;
import com.linkscout.core.model.Link;
import com.linkscout.core.model.LinkType;
import com.linkscout.core.model.PageComment;
import com.linkscout.core.model.PageContent;
import com.linkscout.core.model.PageFetchResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlServiceTest {

    private HttpServer server;
    private String base;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            switch (ex.getRequestURI().getPath()) {
                case "/" -> send(ex, 200, "text/html",
                        "<html><head><title>Home</title></head><body>"
                                + "<nav><a href='/about'>About</a></nav>"
                                + "<a href='/files/r.pdf'>Report</a>"
                                + "<a href='https://other.org/'>Other</a>"
                                + "<a href='mailto:x@ex.com'>Mail</a>"
                                + "<h1 class='headline'>Welcome</h1>"
                                + "</body></html>");
                case "/about" -> send(ex, 200, "text/html", "<html><body><a href='/'>Home</a></body></html>");
                case "/files/r.pdf" -> send(ex, 200, "application/pdf", "%PDF-1.4");
                default -> send(ex, 404, "text/html", "nope");
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private static void send(HttpExchange ex, int status, String type, String body) throws IOException {
        ex.getResponseHeaders().add("Content-Type", type);
        if ("HEAD".equals(ex.getRequestMethod())) {
            ex.sendResponseHeaders(status, -1);
            ex.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private CrawlConfig cfg() {
        return CrawlConfig.defaults().setTarget(base + "/").setMaxDepth(2).setConcurrency(2).setTimeoutMs(3000);
    }

    @Test
    @DisplayName("로컬 사이트 전체 흐름: 크롤 → 리포트")
    void crawlsLocalSite() {
        CrawlReport rep;
        try (CrawlService svc = new CrawlService(cfg())) {
            rep = svc.run();
        }

        assertThat(rep.result().getState()).isEqualTo(CrawlState.DONE);
        assertThat(rep.info().pagesCrawled()).isEqualTo(2);
        assertThat(rep.result().getLinks()).extracting(Link::getResolvedUrl).containsExactly(
                base + "/about", base + "/files/r.pdf", "https://other.org/", "mailto:x@ex.com", base + "/");
        assertThat(rep.count(LinkType.PAGE)).isEqualTo(3);
        assertThat(rep.count(LinkType.DOCUMENT)).isEqualTo(1);
        assertThat(rep.count(LinkType.OTHER)).isEqualTo(1);
        assertThat(rep.internalLinks()).isEqualTo(3);
        assertThat(rep.externalLinks()).isEqualTo(2);
        assertThat(rep.info().filesFound()).isEqualTo(2);
        assertThat(rep.result().getPages().get(0).title()).isEqualTo("Home");
    }

    @Test
    @DisplayName("필터 + 링크 검증: 내부 링크만 남기고 HEAD로 확인")
    void filterThenValidate() {
        CrawlConfig c = cfg();
        c.getFilter().setInternalOnly(true);
        c.getValidation().setEnabled(true).setRps(100);

        CrawlReport rep;
        try (CrawlService svc = new CrawlService(c)) {
            rep = svc.run();
        }

        assertThat(rep.result().getLinks()).extracting(Link::getResolvedUrl)
                .containsExactly(base + "/about", base + "/files/r.pdf", base + "/");
        assertThat(rep.validatedLinks()).isEqualTo(3);
        assertThat(rep.accessibleLinks()).isEqualTo(3);
        assertThat(rep.result().getLinks()).allSatisfy(l -> assertThat(l.getValidation().statusCode()).isEqualTo(200));
    }

    @Test
    void typeFilter_documentsOnly() {
        CrawlConfig c = cfg();
        c.getFilter().setTypes(List.of("documents"));
        try (CrawlService svc = new CrawlService(c)) {
            assertThat(svc.run().result().getLinks()).extracting(Link::getResolvedUrl)
                    .containsExactly(base + "/files/r.pdf");
        }
    }

    @Test
    @DisplayName("규칙 기반 추출: 시드 페이지 한 장")
    void extractStructured() throws Exception {
        RuleExtractor rules = RuleExtractor.fromJson(
                "{\"title\":{\"selector\":\"title\"},\"headline\":{\"selector\":\"h1.headline\"},"
                        + "\"links\":{\"selector\":\"a\",\"attribute\":\"href\",\"all\":true}}");
        Map<String, Object> out;
        try (CrawlService svc = new CrawlService(cfg())) {
            out = svc.extractStructured(rules);
        }
        assertThat(out).containsEntry("title", "Home").containsEntry("headline", "Welcome");
        assertThat(out.get("links")).isEqualTo(List.of("/about", "/files/r.pdf", "https://other.org/", "mailto:x@ex.com"));
    }

    @Test
    @DisplayName("셀렉터 추출: 요소마다 text/html/attributes/href")
    void extractElements() throws Exception {
        List<ElementData> out;
        try (CrawlService svc = new CrawlService(cfg())) {
            out = svc.extractElements("nav a, h1");
        }
        assertThat(out).hasSize(2);
        ElementData about = out.get(0);
        assertThat(about.text()).isEqualTo("About");
        assertThat(about.href()).isEqualTo("/about");
        assertThat(about.attributes()).containsExactly(Map.entry("href", "/about"));
        assertThat(about.html()).isEqualTo("<a href=\"/about\">About</a>");

        ElementData h1 = out.get(1);
        assertThat(h1.text()).isEqualTo("Welcome");
        assertThat(h1.href()).isNull();
        assertThat(h1.attributes()).containsEntry("class", "headline");
    }

    @Test
    void extractElements_invalidSelectorRejected() {
        try (CrawlService svc = new CrawlService(cfg())) {
            assertThatThrownBy(() -> svc.extractElements("div[")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> svc.extractElements(" ")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("본문 요약: 제목, 상태, 길이, 500자 미리보기, 주석")
    void extractContent() throws Exception {
        List<FetchRequest> seen = new ArrayList<>();
        IPageFetcher fake = req -> {
            seen.add(req);
            return PageFetchResult.builder()
                    .requestedUrl(req.url())
                    .status(203)
                    .html("<html><head><title>Long read</title></head><body><!-- build 42 -->"
                            + "<p>" + "x".repeat(600) + "</p></body></html>")
                    .build();
        };
        CrawlConfig c = cfg().setScreenshot(Path.of("shot.png")); // renderJs 꺼짐 → 무시
        c.getComments().setEnabled(true).setType("html");

        PageContent out;
        try (CrawlService svc = new CrawlService(c, fake, null)) {
            out = svc.extractContent();
        }

        assertThat(out.url()).isEqualTo(base + "/");
        assertThat(out.title()).isEqualTo("Long read");
        assertThat(out.statusCode()).isEqualTo(203);
        assertThat(out.textLength()).isEqualTo(600);
        assertThat(out.contentPreview()).hasSize(503).endsWith("x...");
        assertThat(out.comments()).extracting(PageComment::content).containsExactly("build 42");
        assertThat(out.screenshot()).isNull();
        assertThat(seen).singleElement().satisfies(r -> assertThat(r.screenshot()).isNull());
    }

    @Test
    @DisplayName("renderJs면 스크린샷 경로가 요청에 실린다")
    void screenshotPassedInRenderMode() throws Exception {
        List<FetchRequest> seen = new ArrayList<>();
        IPageFetcher fake = req -> {
            seen.add(req);
            return PageFetchResult.builder().requestedUrl(req.url())
                    .html("<html><body><p>short</p></body></html>")
                    .screenshot(req.screenshot())
                    .build();
        };
        CrawlConfig c = cfg().setRenderJs(true).setScreenshot(Path.of("shot.png"));

        PageContent out;
        try (CrawlService svc = new CrawlService(c, fake, null)) {
            out = svc.extractContent();
        }

        assertThat(seen.get(0).renderJs()).isTrue();
        assertThat(out.screenshot()).isEqualTo(Path.of("shot.png"));
        assertThat(out.contentPreview()).isEqualTo("short");
        assertThat(out.comments()).isEmpty();
    }

    @Test
    @DisplayName("시드에 연결할 수 없으면 FAILED 리포트")
    void unreachableSeed() throws Exception {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        CrawlConfig c = CrawlConfig.defaults().setTarget("http://127.0.0.1:" + port + "/").setTimeoutMs(2000);
        try (CrawlService svc = new CrawlService(c)) {
            CrawlReport rep = svc.run();
            assertThat(rep.result().getState()).isEqualTo(CrawlState.FAILED);
            assertThat(rep.result().getErrors()).singleElement()
                    .satisfies(e -> assertThat(e.kind()).isEqualTo(ErrorKind.CONNECTION_REFUSED));
        }
    }

    @Test
    @DisplayName("설정 오류는 어떤 요청보다 먼저 거부")
    void configErrorBeforeAnyFetch() {
        AtomicInteger calls = new AtomicInteger();
        IPageFetcher counting = req -> {
            calls.incrementAndGet();
            throw new IllegalStateException("must not be called");
        };

        CrawlConfig noTarget = CrawlConfig.defaults();
        assertThatThrownBy(() -> new CrawlService(noTarget, counting, null)).isInstanceOf(NullPointerException.class);

        CrawlConfig badRps = cfg();
        badRps.getValidation().setRps(0);
        assertThatThrownBy(() -> new CrawlService(badRps, counting, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rps");

        CrawlConfig both = cfg();
        both.getFilter().setInternalOnly(true).setExternalOnly(true);
        assertThatThrownBy(() -> new CrawlService(both, counting, null)).isInstanceOf(IllegalArgumentException.class);

        assertThat(calls.get()).isZero();
    }

    @Test
    void cancelFlag_returnsCancelledReport() {
        AtomicInteger calls = new AtomicInteger();
        IPageFetcher counting = req -> {
            calls.incrementAndGet();
            throw new IllegalStateException("must not be called");
        };
        try (CrawlService svc = new CrawlService(cfg(), counting, null)) {
            CrawlReport rep = svc.run(com.linkscout.core.util.ProgressListener.NONE, new AtomicBoolean(true));
            assertThat(rep.result().getState()).isEqualTo(CrawlState.CANCELLED);
            assertThat(rep.info().pagesCrawled()).isZero();
        }
        assertThat(calls.get()).isZero();
    }
}
