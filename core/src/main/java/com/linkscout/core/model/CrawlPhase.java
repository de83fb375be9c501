package com.linkscout.core.model;

/** 스케줄러 진행 단계(관측용) */
public enum CrawlPhase {
    IDLE, FETCHING, EXTRACTING, ENQUEUING, DONE, FAILED
}
