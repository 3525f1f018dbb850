package com.example.ggstorecrawling.controller;

import com.example.ggstorecrawling.entity.JobType;
import com.example.ggstorecrawling.ledger.CrawlJob;
import com.example.ggstorecrawling.ledger.ErrorEntry;
import com.example.ggstorecrawling.ledger.LedgerSummary;
import com.example.ggstorecrawling.service.CrawlLedgerService;
import com.example.ggstorecrawling.service.CrawlRequest;
import com.example.ggstorecrawling.service.CrawlingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 크롤링 제어 REST API 컨트롤러
 *
 * 주요 기능:
 * 1. 크롤링 실행 (전체 / 증분 / 실패 재시도 / 단일 상품)
 * 2. 장부(체크리스트) 현황 조회
 * 3. 미해결 오류 조회 및 해결 처리
 * 4. 작업 일시 정지 / 재개
 *
 * 크롤링은 별도 스레드에서 실행되며 즉시 응답을 반환합니다.
 * 진행 상황은 /status API 로 확인할 수 있습니다. 동시에 하나의 크롤링만 실행됩니다.
 */
@Slf4j
@Tag(name = "Crawling Controller", description = "GGStore 상품 크롤링 제어 API")
@RestController
@RequiredArgsConstructor
public class CrawlingController {

    private final CrawlingService crawlingService;
    private final CrawlLedgerService ledgerService;

    @Operation(summary = "1. 전체 크롤링",
               description = "상품 목록 페이지를 모두 탐색하여 상품 정보와 이미지를 수집합니다. " +
                       "skipExisting 이 true 이면 metadata.json 에 이미 있는 상품은 건너뜁니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "크롤링 작업이 시작됨"),
        @ApiResponse(responseCode = "409", description = "이미 실행 중인 크롤링이 있음")
    })
    @PostMapping("/crawl")
    public ResponseEntity<String> crawl(
        @Parameter(description = "이미 다운로드된 상품 건너뛰기 (기본값: 설정값)", example = "true")
        @RequestParam(required = false) Boolean skipExisting,
        @Parameter(description = "브라우저 headless 모드 (기본값: 설정값)", example = "true")
        @RequestParam(required = false) Boolean headless) {
        CrawlJob job = crawlingService.startAsync(CrawlRequest.builder()
                .type(JobType.FULL_CRAWL)
                .skipExisting(skipExisting)
                .headless(headless)
                .build());
        return ResponseEntity.ok(job.getId() + " 전체 크롤링을 시작했습니다.");
    }

    @Operation(summary = "2. 증분 크롤링",
               description = "상품 목록을 탐색하되 metadata.json 에 없는 신규 상품만 처리합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "크롤링 작업이 시작됨"),
        @ApiResponse(responseCode = "409", description = "이미 실행 중인 크롤링이 있음")
    })
    @PostMapping("/crawl/incremental")
    public ResponseEntity<String> crawlIncremental() {
        CrawlJob job = crawlingService.startAsync(CrawlRequest.builder().type(JobType.INCREMENTAL).build());
        return ResponseEntity.ok(job.getId() + " 증분 크롤링을 시작했습니다.");
    }

    @Operation(summary = "3. 실패 상품 재시도",
               description = "미해결 오류가 있는 상품과 이미지 다운로드가 실패한 상품을 다시 처리합니다. " +
                       "성공하면 해당 상품의 오류가 해결 처리됩니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "재시도 작업이 시작됨"),
        @ApiResponse(responseCode = "409", description = "이미 실행 중인 크롤링이 있음")
    })
    @PostMapping("/crawl/retry-failed")
    public ResponseEntity<String> retryFailed() {
        CrawlJob job = crawlingService.startAsync(CrawlRequest.builder().type(JobType.RETRY_FAILED).build());
        return ResponseEntity.ok(job.getId() + " 실패 상품 재시도를 시작했습니다.");
    }

    @Operation(summary = "4. 단일 상품 크롤링",
               description = "지정한 상품 페이지 하나만 처리합니다. 이미 다운로드된 상품이어도 다시 처리합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "크롤링 작업이 시작됨"),
        @ApiResponse(responseCode = "400", description = "상품 URL 이 비어 있음"),
        @ApiResponse(responseCode = "409", description = "이미 실행 중인 크롤링이 있음")
    })
    @PostMapping("/crawl/product")
    public ResponseEntity<String> crawlProduct(
        @Parameter(description = "상품 페이지 URL", example = "https://ggstore.com/products/classic-tee")
        @RequestParam String url) {
        CrawlJob job = crawlingService.startAsync(CrawlRequest.builder()
                .type(JobType.SINGLE_PRODUCT)
                .targetUrl(url)
                .build());
        return ResponseEntity.ok(job.getId() + " 단일 상품 크롤링을 시작했습니다: " + url);
    }

    @Operation(summary = "5. 전체 작업 현황 조회",
               description = "현재 세션, 작업/상품/이미지 통계, 미해결 오류 수, 메타데이터 동기화 상태를 보여줍니다.")
    @ApiResponse(responseCode = "200", description = "현재 작업 현황")
    @GetMapping("/status")
    public ResponseEntity<LedgerSummary> getStatus() {
        return ResponseEntity.ok(ledgerService.getSummary());
    }

    @Operation(summary = "6. 미해결 오류 조회")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "미해결 오류 목록 (오래된 순)"),
        @ApiResponse(responseCode = "400", description = "파라미터 'limit'가 1 미만")
    })
    @GetMapping("/errors")
    public ResponseEntity<?> getErrors(
        @Parameter(description = "최대 개수 (기본값: 10)", example = "10")
        @RequestParam(defaultValue = "10") int limit) {
        if (limit <= 0) {
            return ResponseEntity.badRequest().body("limit 는 1 이상이어야 합니다.");
        }
        List<ErrorEntry> errors = ledgerService.getUnresolvedErrors().stream()
                .limit(limit)
                .collect(Collectors.toList());
        return ResponseEntity.ok(errors);
    }

    @Operation(summary = "7. 오류 해결 처리")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "해결 처리됨 (이미 해결된 오류 포함)"),
        @ApiResponse(responseCode = "404", description = "오류 ID 가 없음")
    })
    @PostMapping("/errors/{errorId}/resolve")
    public ResponseEntity<String> resolveError(@PathVariable String errorId) {
        if (!ledgerService.resolveError(errorId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("오류를 찾을 수 없습니다: " + errorId);
        }
        return ResponseEntity.ok(errorId + " 해결 처리되었습니다.");
    }

    @Operation(summary = "8. 작업 일시 정지",
               description = "실행 중인 작업을 현재 상품 처리 후 멈춥니다. resume 으로 이어서 진행합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "일시 정지됨"),
        @ApiResponse(responseCode = "404", description = "작업 ID 가 없음"),
        @ApiResponse(responseCode = "409", description = "일시 정지할 수 없는 상태")
    })
    @PostMapping("/jobs/{jobId}/pause")
    public ResponseEntity<?> pauseJob(@PathVariable String jobId) {
        if (ledgerService.findJob(jobId).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("작업을 찾을 수 없습니다: " + jobId);
        }
        return ResponseEntity.ok(ledgerService.pauseJob(jobId));
    }

    @Operation(summary = "9. 작업 재개")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "재개됨"),
        @ApiResponse(responseCode = "404", description = "작업 ID 가 없음"),
        @ApiResponse(responseCode = "409", description = "재개할 수 없는 상태")
    })
    @PostMapping("/jobs/{jobId}/resume")
    public ResponseEntity<?> resumeJob(@PathVariable String jobId) {
        if (ledgerService.findJob(jobId).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("작업을 찾을 수 없습니다: " + jobId);
        }
        return ResponseEntity.ok(ledgerService.resumeJob(jobId));
    }

    /** 이미 실행 중이거나 허용되지 않는 상태 전이 */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<String> handleConflict(IllegalStateException e) {
        log.warn("요청 거부: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
