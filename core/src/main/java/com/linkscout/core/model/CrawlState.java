package com.linkscout.core.model;

/** 크롤 종료 상태 */
public enum CrawlState {
    /** 프론티어 소진 또는 페이지/깊이 예산 도달 */
    DONE,
    /** 시드 자체를 가져오지 못함 */
    FAILED,
    /** 외부 취소 신호로 중단(부분 결과 유효) */
    CANCELLED
}
