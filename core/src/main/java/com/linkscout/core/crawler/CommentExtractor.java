package com.linkscout.core.crawler;

import com.linkscout.core.model.CommentType;
import com.linkscout.core.model.CrawlConfig;
import com.linkscout.core.model.PageComment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 페이지 주석 추출(링크 추출과 독립).
 * - HTML 주석: 원문 HTML 전체에서 <!-- ... -->
 * - JS 주석: 인라인 <script> 본문에서만 // ... 와 /* ... *&#47;
 * 내용은 앞뒤 공백 제거, 빈 주석은 버린다.
 */
public final class CommentExtractor {

    private static final Pattern HTML_COMMENT = Pattern.compile("<!--\\s*(.*?)\\s*-->", Pattern.DOTALL);
    // "http://" 같은 문자열 안의 // 는 제외
    private static final Pattern JS_SINGLE = Pattern.compile("(?<![:\\\\/])//[ \\t]*([^\\r\\n]*)");
    private static final Pattern JS_MULTI = Pattern.compile("/\\*\\s*(.*?)\\s*\\*/", Pattern.DOTALL);

    private final Set<CommentType> types;
    private final int minLength;

    public CommentExtractor(Set<CommentType> types, int minLength) {
        this.types = (types == null || types.isEmpty()) ? EnumSet.allOf(CommentType.class) : EnumSet.copyOf(types);
        this.minLength = Math.max(0, minLength);
    }

    /** comments.enabled=false 면 null */
    public static CommentExtractor fromConfig(CrawlConfig.CommentsCfg c) {
        Objects.requireNonNull(c, "comments");
        if (!c.isEnabled()) return null;
        return new CommentExtractor(CommentType.parseFilter(c.getType()), c.getMinLength());
    }

    public List<PageComment> extract(String rawHtml, Document doc) {
        List<PageComment> out = new ArrayList<>();
        if (types.contains(CommentType.HTML) && rawHtml != null) {
            scan(rawHtml, HTML_COMMENT, CommentType.HTML, "html", out);
        }
        boolean single = types.contains(CommentType.JAVASCRIPT_SINGLE);
        boolean multi = types.contains(CommentType.JAVASCRIPT_MULTI);
        if ((single || multi) && doc != null) {
            for (Element script : doc.select("script:not([src])")) {
                String js = script.data();
                if (js.isEmpty()) continue;
                if (single) scan(js, JS_SINGLE, CommentType.JAVASCRIPT_SINGLE, "inline_script", out);
                if (multi) scan(js, JS_MULTI, CommentType.JAVASCRIPT_MULTI, "inline_script", out);
            }
        }
        return out;
    }

    private void scan(String text, Pattern p, CommentType type, String location, List<PageComment> out) {
        Matcher m = p.matcher(text);
        while (m.find()) {
            String content = m.group(1).trim();
            if (content.isEmpty() || content.length() < minLength) continue;
            out.add(new PageComment(type, content, lineOf(text, m.start()), m.start(), location));
        }
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') line++;
        }
        return line;
    }
}
