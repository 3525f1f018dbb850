package com.example.ggstorecrawling.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 작업 시작 시점의 설정 스냅샷
 */
@Getter
@Setter
@NoArgsConstructor
public class JobConfig {

    private boolean headless = true;
    private double delaySeconds = 1.5;
    private int maxConcurrentDownloads = 5;
    private boolean skipExisting = true;
    private String outputDir = "data/images";
    private String metadataFile = "data/metadata.json";

    /** SINGLE_PRODUCT 작업의 대상 URL */
    private String targetUrl;
}
