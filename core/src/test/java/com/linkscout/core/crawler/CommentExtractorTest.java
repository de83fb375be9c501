package com.linkscout.core.crawler;

import com.linkscout.core.model.CommentType;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.PageComment;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class CommentExtractorTest {

    private static final String HTML = "<html><head><!-- build: 2024-01-01 --><script>\n"
            + "// init tracker\n"
            + "var u = \"http://ex.com/x\"; /* multi\n"
            + "line */\n"
            + "</script><script src=\"/a.js\">// ignored external</script></head>"
            + "<body><!----><p>hi</p><!-- short --></body></html>";

    private static List<String> contents(List<PageComment> cs) {
        return cs.stream().map(PageComment::content).collect(Collectors.toList());
    }

    @Test
    @DisplayName("HTML 주석 + 인라인 스크립트의 JS 주석, URL 안의 // 는 제외")
    void extractsAllTypes() {
        Document doc = Jsoup.parse(HTML);
        List<PageComment> cs = new CommentExtractor(null, 0).extract(HTML, doc);

        assertThat(contents(cs)).containsExactly("build: 2024-01-01", "short", "init tracker", "multi\nline");

        PageComment html = cs.get(0);
        assertThat(html.type()).isEqualTo(CommentType.HTML);
        assertThat(html.location()).isEqualTo("html");
        assertThat(html.lineStart()).isEqualTo(1);
        assertThat(html.position()).isEqualTo(HTML.indexOf("<!-- build"));

        PageComment single = cs.get(2);
        assertThat(single.type()).isEqualTo(CommentType.JAVASCRIPT_SINGLE);
        assertThat(single.location()).isEqualTo("inline_script");
        assertThat(single.lineStart()).isEqualTo(2); // 스크립트 본문은 개행으로 시작

        PageComment multi = cs.get(3);
        assertThat(multi.type()).isEqualTo(CommentType.JAVASCRIPT_MULTI);
        assertThat(multi.lineStart()).isEqualTo(3);
    }

    @Test
    @DisplayName("타입 필터와 최소 길이")
    void filtersByTypeAndLength() {
        Document doc = Jsoup.parse(HTML);

        List<PageComment> htmlOnly = new CommentExtractor(EnumSet.of(CommentType.HTML), 6).extract(HTML, doc);
        assertThat(contents(htmlOnly)).containsExactly("build: 2024-01-01");

        List<PageComment> js = new CommentExtractor(CommentType.parseFilter("javascript"), 0).extract(HTML, doc);
        assertThat(js).extracting(PageComment::type)
                .containsExactly(CommentType.JAVASCRIPT_SINGLE, CommentType.JAVASCRIPT_MULTI);
    }

    @Test
    @DisplayName("fromConfig: 비활성이면 null, 활성이면 타입 필터 반영")
    void fromConfig() {
        CrawlConfig.CommentsCfg off = new CrawlConfig.CommentsCfg();
        assertThat(CommentExtractor.fromConfig(off)).isNull();

        CrawlConfig.CommentsCfg on = new CrawlConfig.CommentsCfg().setEnabled(true).setType("js_multi");
        CommentExtractor ce = CommentExtractor.fromConfig(on);
        assertThat(ce).isNotNull();
        assertThat(contents(ce.extract(HTML, Jsoup.parse(HTML)))).containsExactly("multi\nline");
    }

    @Test
    void noScriptsNoComments() {
        String html = "<p>plain</p>";
        assertThat(new CommentExtractor(null, 0).extract(html, Jsoup.parse(html))).isEmpty();
    }
}
