package com.example.ggstorecrawling.ledger;

import com.example.ggstorecrawling.entity.JobStatus;
import lombok.Builder;
import lombok.Value;

/**
 * 상품 업서트 요청 값
 */
@Value
@Builder
public class ProductUpdate {
    String productId;
    String name;
    String url;
    String jobId;
    @Builder.Default
    JobStatus status = JobStatus.COMPLETED;
    int imageCount;
    int downloadedCount;
    int failedCount;
    String price;
    String category;
}
