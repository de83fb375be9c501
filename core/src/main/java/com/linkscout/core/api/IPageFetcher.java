// IPageFetcher.java
package com.linkscout.core.api;

import com.linkscout.core.http.FetchException;
import com.linkscout.core.model.FetchRequest;
import com.linkscout.core.model.PageFetchResult;

/**
 * 페이지 페처 최소 계약: URL → 최종 URL/상태/HTML.
 * 모든 호출은 request.timeout() 안에 끝나야 한다.
 * renderJs를 지원하지 못하면 일반 HTTP로 대체하고 jsFallback=true로 알린다(예외 아님).
 */
public interface IPageFetcher extends AutoCloseable {
    PageFetchResult fetch(FetchRequest request) throws FetchException;
    @Override default void close() {}
}
