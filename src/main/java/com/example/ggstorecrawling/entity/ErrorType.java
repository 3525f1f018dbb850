package com.example.ggstorecrawling.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 오류 로그에 기록되는 오류 종류
 */
public enum ErrorType {
    /** 상품 페이지 접속/렌더링 실패 */
    CRAWL_FAILED("crawl_failed"),

    /** 페이지에서 쓸 수 있는 데이터를 찾지 못함 */
    PARSE_FAILED("parse_failed"),

    /** 개별 이미지 다운로드 실패 */
    DOWNLOAD_FAILED("download_failed"),

    /** 제한 시간 초과 */
    TIMEOUT("timeout");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ErrorType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 오류 종류입니다: " + value));
    }
}
