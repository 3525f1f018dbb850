package com.example.ggstorecrawling.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum MetadataSyncStatus {
    IN_SYNC("in_sync"),
    OUT_OF_SYNC("out_of_sync"),
    NEEDS_REBUILD("needs_rebuild");

    private final String value;

    MetadataSyncStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MetadataSyncStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 동기화 상태입니다: " + value));
    }
}
