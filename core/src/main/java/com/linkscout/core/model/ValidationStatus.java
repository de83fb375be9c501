package com.linkscout.core.model;

/** 링크 도달성 검사 결과. statusCode 0 = 응답 없음(unreachable). */
public record ValidationStatus(int statusCode, boolean accessible, String error) {

    public static ValidationStatus ofStatus(int code) {
        return new ValidationStatus(code, code >= 200 && code < 400, null);
    }

    public static ValidationStatus unreachable(String error) {
        return new ValidationStatus(0, false, error == null ? "unreachable" : error);
    }

    public static ValidationStatus notApplicable() {
        return new ValidationStatus(0, false, "not an http(s) link");
    }
}
