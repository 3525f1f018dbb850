package com.example.ggstorecrawling.ledger;

import com.example.ggstorecrawling.entity.JobStatus;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 장부에 기록되는 상품 항목
 *
 * 처음 발견될 때 만들어지고, 같은 ID 로 다시 크롤링될 때마다 제자리에서 갱신됩니다.
 */
@Getter
@Setter
@NoArgsConstructor
public class ProductEntry {

    private String id;
    private String name;
    private String url;
    private JobStatus status = JobStatus.PENDING;
    private CrawlInfo crawlInfo;
    private ImageStatus images = new ImageStatus();
    private PriceInfo price = new PriceInfo();
    private String category;
    /** 이 상품에 대해 누적된 오류 메시지 */
    private List<String> errors = new ArrayList<>();

    /** 크롤링 이력 */
    @Getter
    @Setter
    @NoArgsConstructor
    public static class CrawlInfo {
        private LocalDateTime firstSeen;
        private LocalDateTime lastCrawled;
        private int crawlCount = 1;
        /** 마지막으로 이 상품을 크롤링한 작업 ID */
        private String jobId;
    }

    /** 이미지 다운로드 현황 */
    @Getter
    @Setter
    @NoArgsConstructor
    public static class ImageStatus {
        private int total;
        private int downloaded;
        private int failed;
        private JobStatus status = JobStatus.PENDING;
    }

    /** 가격 추적 */
    @Getter
    @Setter
    @NoArgsConstructor
    public static class PriceInfo {
        private String current;
        private LocalDateTime lastSeen;
    }
}
