package com.linkscout.core.crawler;

import com.linkscout.core.model.ElementData;
import com.linkscout.core.model.PageComment;
import com.linkscout.core.model.PageContent;
import com.linkscout.core.model.PageFetchResult;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 크롤 없이 한 페이지만 보는 추출:
 *  - select: 셀렉터에 걸린 요소마다 text/html/attributes/href
 *  - summarize: 제목, 상태, 본문 길이, 앞 500자 미리보기, (옵션) 주석
 */
public final class PageContentExtractor {
    private PageContentExtractor(){}

    static final int PREVIEW_CHARS = 500;

    /** 잘못된 셀렉터는 IllegalArgumentException */
    public static List<ElementData> select(Document doc, String selector) {
        Objects.requireNonNull(doc, "doc");
        if (selector == null || selector.isBlank()) throw new IllegalArgumentException("selector is empty");

        Elements found;
        try {
            found = doc.select(selector);
        } catch (Selector.SelectorParseException e) {
            throw new IllegalArgumentException("Invalid selector: " + selector, e);
        }

        List<ElementData> out = new ArrayList<>(found.size());
        for (Element el : found) {
            Map<String, String> attrs = new LinkedHashMap<>();
            for (Attribute a : el.attributes()) attrs.put(a.getKey(), a.getValue());
            out.add(new ElementData(el.text(), el.outerHtml(), attrs, el.hasAttr("href") ? el.attr("href") : null));
        }
        return out;
    }

    /** comments가 null이면 주석 없이 */
    public static PageContent summarize(PageFetchResult page, Document doc, CommentExtractor comments) {
        Objects.requireNonNull(page, "page");
        Objects.requireNonNull(doc, "doc");

        String text = (doc.body() == null) ? "" : doc.body().text().trim();
        if (text.isEmpty()) text = page.rawHtml(); // body가 비면 원문 그대로

        String preview = (text.length() > PREVIEW_CHARS) ? text.substring(0, PREVIEW_CHARS) + "..." : text;
        List<PageComment> cs = (comments == null) ? List.of() : comments.extract(page.rawHtml(), doc);

        return new PageContent(page.getRequestedUrl().toString(), doc.title(), page.getStatus(),
                text.length(), preview, cs, page.getScreenshot());
    }
}
