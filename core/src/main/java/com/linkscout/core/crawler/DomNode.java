package com.linkscout.core.crawler;

/** SourceDetector가 필요로 하는 최소한의 트리 뷰. 파서 구현과 분리하기 위한 계약 */
public interface DomNode {
    /** 소문자 태그 이름 */
    String tagName();

    /** class 속성 원문(없으면 "") */
    String className();

    /** id 속성 원문(없으면 "") */
    String id();

    /** 루트면 null */
    DomNode parent();
}
