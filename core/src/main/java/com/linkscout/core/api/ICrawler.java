// ICrawler.java
package com.linkscout.core.api;

import com.linkscout.core.model.CrawlResult;

/** 크롤러 최소 계약: 한 번의 크롤을 끝까지 돌리고 결과 스냅샷을 돌려준다. */
public interface ICrawler extends AutoCloseable {
    /** 페이지 단위 실패는 결과에 기록되고 예외로 던지지 않는다 */
    CrawlResult crawl();

    /** 새 페치 발행을 멈춘다. 진행 중인 페치는 끝나거나 타임아웃될 때까지 둔다 */
    void cancel();

    @Override default void close() throws Exception {}
}
