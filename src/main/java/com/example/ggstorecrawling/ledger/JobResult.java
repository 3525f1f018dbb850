package com.example.ggstorecrawling.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 완료된 작업의 결과 요약
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {
    private boolean success;
    private int totalProducts;
    private int totalImages;
    private int newProducts;
    private int newImages;
    private int skippedProducts;
    private int failedDownloads;
    private String errorMessage;

    public static JobResult failure(String errorMessage) {
        return JobResult.builder().success(false).errorMessage(errorMessage).build();
    }
}
