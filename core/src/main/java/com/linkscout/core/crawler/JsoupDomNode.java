package com.linkscout.core.crawler;

import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Objects;

/** jsoup Element → DomNode 어댑터 */
public final class JsoupDomNode implements DomNode {
    private final Element el;

    private JsoupDomNode(Element el) {
        this.el = el;
    }

    public static DomNode of(Element el) {
        return new JsoupDomNode(Objects.requireNonNull(el, "el"));
    }

    @Override public String tagName() { return el.normalName().toLowerCase(Locale.ROOT); }
    @Override public String className() { return el.className(); }
    @Override public String id() { return el.id(); }

    @Override
    public DomNode parent() {
        Element p = el.parent();
        return (p == null) ? null : new JsoupDomNode(p);
    }
}
