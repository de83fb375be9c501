package com.linkscout.core.http;

import com.linkscout.core.model.FetchRequest;
import com.linkscout.core.model.PageFetchResult;

/** 헤드리스 브라우저 렌더링 전략. 실행 환경이 없으면 isAvailable()=false */
public interface JsRenderer extends AutoCloseable {

    boolean isAvailable();

    /** 스크립트 실행 후 DOM을 HTML로 돌려준다 */
    PageFetchResult render(FetchRequest request) throws FetchException;

    @Override void close();
}
