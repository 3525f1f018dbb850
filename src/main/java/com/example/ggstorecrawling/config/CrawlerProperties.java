package com.example.ggstorecrawling.config;

import com.example.ggstorecrawling.ledger.JobConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 크롤러 설정 (application.properties 의 crawler.* 항목)
 */
@Component
@ConfigurationProperties(prefix = "crawler")
@Data
public class CrawlerProperties {

    /** 크롤링 대상 사이트 */
    private String baseUrl = "https://ggstore.com";

    /** 상품 목록(컬렉션) 경로. ?page=N 이 붙습니다 */
    private String collectionPath = "/collections/all";

    /** 목록 페이지 최대 탐색 수 (무한 루프 방지) */
    private int maxPages = 50;

    /** 상품 N 개를 처리할 때마다 metadata.json 중간 저장 */
    private int checkpointInterval = 10;

    /** 요청 사이 대기 시간 (초) */
    private double delaySeconds = 1.5;

    /** 이미 다운로드된 상품 건너뛰기 */
    private boolean skipExisting = true;

    /** 장부(Job/세션/오류)에 기록되는 실행 주체 이름 */
    private String agentName = "crawler-agent";

    /** 고정 User-Agent (브라우저, 이미지 다운로드 공통) */
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private Storage storage = new Storage();
    private Download download = new Download();
    private Browser browser = new Browser();

    @Data
    public static class Storage {
        private String outputDir = "data/images";
        private String metadataFile = "data/metadata.json";
        private String checklistFile = "store_parser_checklist.yaml";
    }

    @Data
    public static class Download {
        private int maxConcurrent = 5;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class Browser {
        private boolean headless = true;
        /** Selenium Grid 사용 여부 (Docker 환경) */
        private boolean useRemote = false;
        private String hubUrl = "http://localhost:4444/wd/hub";
        /** 로컬 chromedriver 경로. 비어 있으면 Selenium Manager 가 찾습니다 */
        private String driverPath;
        private int pageLoadTimeoutSeconds = 60;
    }

    /**
     * 현재 설정으로 작업 설정 스냅샷을 만듭니다.
     */
    public JobConfig toJobConfig() {
        JobConfig config = new JobConfig();
        config.setHeadless(browser.isHeadless());
        config.setDelaySeconds(delaySeconds);
        config.setMaxConcurrentDownloads(download.getMaxConcurrent());
        config.setSkipExisting(skipExisting);
        config.setOutputDir(storage.getOutputDir());
        config.setMetadataFile(storage.getMetadataFile());
        return config;
    }
}
