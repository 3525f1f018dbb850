package com.example.ggstorecrawling.service;

import com.example.ggstorecrawling.entity.JobType;
import lombok.Builder;
import lombok.Value;

/**
 * 크롤링 실행 요청
 *
 * null 인 항목은 application.properties 의 crawler.* 설정값을 사용합니다.
 */
@Value
@Builder
public class CrawlRequest {

    @Builder.Default
    JobType type = JobType.FULL_CRAWL;

    /** SINGLE_PRODUCT 작업의 대상 상품 URL */
    String targetUrl;

    String outputDir;
    String metadataFile;
    Double delaySeconds;
    Boolean headless;
    Boolean skipExisting;

    /** high, medium, low */
    @Builder.Default
    String priority = "medium";
}
