package com.example.ggstorecrawling.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 크롤링 작업 종류
 */
public enum JobType {
    /** 목록 전체를 탐색하여 모든 상품을 처리 */
    FULL_CRAWL("full_crawl"),

    /** 메타데이터에 없는 신규 상품만 처리 */
    INCREMENTAL("incremental"),

    /** 미해결 오류와 이미지 실패 상품만 다시 처리 */
    RETRY_FAILED("retry_failed"),

    /** 지정한 상품 URL 하나만 처리 */
    SINGLE_PRODUCT("single_product");

    private final String value;

    JobType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 작업 종류입니다: " + value));
    }
}
