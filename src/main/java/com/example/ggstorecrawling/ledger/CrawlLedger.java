package com.example.ggstorecrawling.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 크롤링 작업 장부(체크리스트) 문서의 루트
 *
 * 작업(Job) 목록, 현재 세션, 상품별 크롤링 이력, 오류 로그, 통계, 메타데이터 동기화 상태를
 * 하나의 YAML 파일에 담습니다. 재시작/재실행 시 이어서 작업하기 위한 유일한 기준입니다.
 */
@Getter
@Setter
@NoArgsConstructor
public class CrawlLedger {

    private String version = "1.0";
    private String project = "ggp_store_parser";
    private String targetSite = "https://ggstore.com";
    private String platform = "Shopify";
    private LocalDateTime createdAt = LocalDateTime.now();
    private LocalDateTime updatedAt = LocalDateTime.now();

    /** 현재(또는 마지막) 세션. 한 번에 하나만 존재 */
    private CrawlSession currentSession;

    private List<CrawlJob> jobs = new ArrayList<>();

    /** 상품 ID → 상품 항목. ID 가 같으면 같은 상품으로 취급 (URL 이 아님) */
    private Map<String, ProductEntry> products = new LinkedHashMap<>();

    /** 오류 로그 (추가만 가능, 삭제하지 않음) */
    private List<ErrorEntry> errors = new ArrayList<>();

    private LedgerStats stats = new LedgerStats();

    private MetadataSync metadataSync = new MetadataSync();

    public Optional<CrawlJob> findJob(String jobId) {
        return jobs.stream().filter(job -> job.getId().equals(jobId)).findFirst();
    }

    public Optional<ProductEntry> findProduct(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    public Optional<ErrorEntry> findError(String errorId) {
        return errors.stream().filter(error -> error.getId().equals(errorId)).findFirst();
    }
}
