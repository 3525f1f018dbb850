package com.example.ggstorecrawling.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.TreeMap;

/**
 * 장부 통계
 *
 * 변경이 일어날 때마다 장부의 컬렉션에서 다시 계산됩니다.
 * lastFullCrawl / lastIncremental 만 작업 완료 시점에 기록되는 값입니다.
 */
@Getter
@Setter
@NoArgsConstructor
public class LedgerStats {

    private int totalProducts;
    private int totalImages;
    private JobStats jobs = new JobStats();
    private DownloadStats downloads = new DownloadStats();
    private Map<String, Integer> byCategory = new TreeMap<>();
    private LocalDateTime lastFullCrawl;
    private LocalDateTime lastIncremental;
    private Long averageCrawlTimeSeconds;

    @Getter
    @Setter
    @NoArgsConstructor
    public static class JobStats {
        private int total;
        private int completed;
        private int failed;
        private int pending;
        private int inProgress;
        private int paused;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class DownloadStats {
        private int successful;
        private int failed;
        private int skipped;
    }
}
