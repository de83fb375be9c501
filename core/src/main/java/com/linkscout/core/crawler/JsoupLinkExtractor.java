package com.linkscout.core.crawler;

import com.linkscout.core.model.Link;
import com.linkscout.core.model.LinkType;
import com.linkscout.core.model.SourceRegion;
import com.linkscout.core.util.DomainScope;
import com.linkscout.core.util.InvalidUrlException;
import com.linkscout.core.util.LinkTypes;
import com.linkscout.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 기본 JSoup 기반 링크 추출기.
 * - a[href], area[href] 항상
 * - extractMedia: link[href], img/script/iframe/embed/source/video/audio[src]
 * - extractSrcset: srcset 후보 전부
 * - <base href>가 있으면 그 기준으로 해석
 */
public class JsoupLinkExtractor implements LinkExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupLinkExtractor.class);

    private static final String ANCHORS = "a[href], area[href]";
    private static final String MEDIA =
            "link[href], img[src], script[src], iframe[src], embed[src], source[src], video[src], audio[src]";
    private static final Set<String> ANCHOR_TAGS = Set.of("a", "area");
    private static final Set<String> MEDIA_TAGS =
            Set.of("link", "img", "script", "iframe", "embed", "source", "video", "audio");

    private final DomainScope scope;
    private final boolean extractMedia;
    private final boolean extractSrcset;

    public JsoupLinkExtractor(DomainScope scope) {
        this(scope, false, false);
    }

    public JsoupLinkExtractor(DomainScope scope, boolean extractMedia, boolean extractSrcset) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.extractMedia = extractMedia;
        this.extractSrcset = extractSrcset;
    }

    @Override
    public List<Link> extract(Document doc, URI pageUrl) {
        List<Link> out = new ArrayList<>();
        if (doc == null || pageUrl == null) return out;

        URI page = UrlUtils.normalize(pageUrl);
        URI base = baseOf(doc, page);
        String foundOn = page.toString();

        String query = ANCHORS;
        if (extractMedia) query += ", " + MEDIA;
        if (extractSrcset) query += ", [srcset]";

        // 한 번의 select → 문서 순서 보장
        for (Element el : doc.select(query)) {
            String tag = el.normalName();
            SourceRegion region = null;

            boolean primary = ANCHOR_TAGS.contains(tag) || (extractMedia && MEDIA_TAGS.contains(tag));
            String attr = ("a".equals(tag) || "area".equals(tag) || "link".equals(tag)) ? "href" : "src";
            if (primary && el.hasAttr(attr)) {
                region = SourceDetector.detect(JsoupDomNode.of(el));
                add(out, el.attr(attr), textOf(el), region, base, foundOn);
            }

            if (extractSrcset && el.hasAttr("srcset")) {
                if (region == null) region = SourceDetector.detect(JsoupDomNode.of(el));
                for (String candidate : srcsetUrls(el.attr("srcset"))) {
                    add(out, candidate, textOf(el), region, base, foundOn);
                }
            }
        }
        return out;
    }

    private void add(List<Link> out, String rawHref, String text, SourceRegion region, URI base, String foundOn) {
        String href = (rawHref == null) ? "" : rawHref.trim();
        if (href.isEmpty() || href.startsWith("#")) return; // 같은 페이지 앵커/빈 값

        Link.Builder b = Link.builder()
                .rawHref(rawHref)
                .text(text)
                .sourceRegion(region)
                .foundOnPage(foundOn);

        String scheme = UrlUtils.schemeOf(href);
        if (!UrlUtils.isCrawlableScheme(scheme)) {
            // mailto/tel/javascript/data: 기록만 하고 절대 가져오지 않음
            out.add(b.resolvedUrl(href)
                    .linkType(LinkType.OTHER)
                    .internal(false)
                    .subdomain(false)
                    .crawlable(false)
                    .build());
            return;
        }

        try {
            URI u = UrlUtils.resolve(href, base);
            String host = u.getHost();
            out.add(b.resolvedUrl(u.toString())
                    .domain(host)
                    .internal(scope.isInternal(host))
                    .subdomain(scope.isSubdomain(host))
                    .linkType(LinkTypes.classify(u))
                    .crawlable(true)
                    .build());
        } catch (InvalidUrlException e) {
            LOG.debug("Skip invalid href on {}: {}", foundOn, e.getMessage());
        }
    }

    /** <base href> 우선, 없거나 깨졌으면 페이지 URL */
    private static URI baseOf(Document doc, URI page) {
        Element baseEl = doc.selectFirst("base[href]");
        if (baseEl == null) return page;
        try {
            return UrlUtils.resolve(baseEl.attr("href"), page);
        } catch (InvalidUrlException e) {
            LOG.debug("Ignore invalid <base href> on {}: {}", page, e.getMessage());
            return page;
        }
    }

    /** 앵커는 보이는 텍스트, 그 외(이미지 등)는 alt → title */
    private static String textOf(Element el) {
        String t = el.text();
        if (!t.isEmpty()) return t;
        String alt = el.attr("alt").trim();
        if (!alt.isEmpty()) return alt.replaceAll("\\s+", " ");
        return el.attr("title").trim().replaceAll("\\s+", " ");
    }

    /** "a.png 1x, b.png 2x" → [a.png, b.png] */
    static List<String> srcsetUrls(String srcset) {
        List<String> urls = new ArrayList<>();
        if (srcset == null) return urls;
        for (String part : srcset.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            int sp = p.indexOf(' ');
            urls.add(sp < 0 ? p : p.substring(0, sp));
        }
        return urls;
    }
}
