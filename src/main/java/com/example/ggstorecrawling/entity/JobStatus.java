package com.example.ggstorecrawling.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * 크롤링 작업(Job)과 세션, 상품 항목의 상태를 나타내는 열거형
 *
 * 작업 상태 흐름:
 * PENDING → IN_PROGRESS → COMPLETED
 *                ↕          ↘
 *              PAUSED      FAILED
 *
 * COMPLETED, FAILED 는 종료 상태이며 더 이상 다른 상태로 바뀌지 않습니다.
 */
public enum JobStatus {
    /** 생성됨, 아직 시작 전 */
    PENDING("pending"),

    /** 실행 중 */
    IN_PROGRESS("in_progress"),

    /** 정상 완료 (종료 상태) */
    COMPLETED("completed"),

    /** 실패 (종료 상태) */
    FAILED("failed"),

    /** 일시 정지, IN_PROGRESS 로 복귀 가능 */
    PAUSED("paused");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 상태입니다: " + value));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 현재 상태에서 다음 상태로 전이할 수 있는지 확인합니다.
     *
     * @param next 전이하려는 상태
     * @return 허용되는 전이면 true
     */
    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    private Set<JobStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(IN_PROGRESS, FAILED);
            case IN_PROGRESS:
                return EnumSet.of(COMPLETED, FAILED, PAUSED);
            case PAUSED:
                return EnumSet.of(IN_PROGRESS, FAILED);
            default:
                return EnumSet.noneOf(JobStatus.class);
        }
    }
}
