package com.linkscout.core.util;

import com.linkscout.core.model.CrawlPhase;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase     스케줄러 현재 단계
     * @param pagesDone 가져오기를 시도한 페이지 수(실패 포함)
     * @param maxPages  페이지 상한
     * @param queued    프론티어에 남은 항목 수
     */
    void onProgress(CrawlPhase phase, int pagesDone, int maxPages, int queued);

    ProgressListener NONE = (phase, d, m, q) -> {};
}
