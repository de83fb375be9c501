package com.linkscout.core.crawler;

import com.linkscout.core.model.Link;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.List;

/** 파싱된 페이지에서 링크를 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * 문서 순서 그대로, 발견한 모든 링크를 반환(중복 제거는 호출자 몫).
     * 해석할 수 없는 href는 건너뛴다. 예외를 던지지 않는다.
     *
     * @param pageUrl 리다이렉트 후 최종 URL. 상대 경로 기준 + foundOnPage
     */
    List<Link> extract(Document doc, URI pageUrl);
}
