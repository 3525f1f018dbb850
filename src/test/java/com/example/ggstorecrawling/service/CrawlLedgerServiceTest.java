package com.example.ggstorecrawling.service;

import com.example.ggstorecrawling.entity.CrawlResult;
import com.example.ggstorecrawling.entity.ErrorType;
import com.example.ggstorecrawling.entity.JobStatus;
import com.example.ggstorecrawling.entity.JobType;
import com.example.ggstorecrawling.entity.Product;
import com.example.ggstorecrawling.ledger.CrawlJob;
import com.example.ggstorecrawling.ledger.CrawlSession;
import com.example.ggstorecrawling.ledger.ErrorEntry;
import com.example.ggstorecrawling.ledger.JobConfig;
import com.example.ggstorecrawling.ledger.JobResult;
import com.example.ggstorecrawling.ledger.LedgerStats;
import com.example.ggstorecrawling.ledger.LedgerSummary;
import com.example.ggstorecrawling.ledger.MetadataSyncStatus;
import com.example.ggstorecrawling.ledger.ProductEntry;
import com.example.ggstorecrawling.ledger.ProductUpdate;
import com.example.ggstorecrawling.ledger.SessionProgressUpdate;
import com.example.ggstorecrawling.repository.LedgerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrawlLedgerService 테스트")
class CrawlLedgerServiceTest {

    @TempDir
    Path tempDir;

    private Path ledgerFile;
    private CrawlLedgerService service;

    @BeforeEach
    void setUp() {
        ledgerFile = tempDir.resolve("store_parser_checklist.yaml");
        service = new CrawlLedgerService(new LedgerRepository(), ledgerFile);
    }

    private CrawlJob startedJob(JobType type) {
        CrawlJob job = service.createJob(type, new JobConfig(), "medium");
        return service.startJob(job.getId(), "test-agent");
    }

    private static ProductUpdate.ProductUpdateBuilder update(String productId) {
        return ProductUpdate.builder()
                .productId(productId)
                .name("Name " + productId)
                .url("https://ggstore.com/products/" + productId)
                .jobId("JOB-001");
    }

    // ===== 작업 =====

    @Test
    @DisplayName("작업 ID 는 JOB-001 부터 순서대로 발급되고 PENDING 으로 시작한다")
    void createJob_sequentialIds() {
        CrawlJob first = service.createJob(JobType.FULL_CRAWL, new JobConfig(), "high");
        CrawlJob second = service.createJob(JobType.INCREMENTAL, new JobConfig(), null);

        assertEquals("JOB-001", first.getId());
        assertEquals("JOB-002", second.getId());
        assertEquals(JobStatus.PENDING, first.getStatus());
        assertEquals("medium", second.getPriority());
        assertEquals(2, service.getPendingJobs().size());
        assertTrue(Files.exists(ledgerFile));
    }

    @Test
    @DisplayName("성공한 전체 크롤링은 COMPLETED 가 되고 실행 시간과 lastFullCrawl 이 기록된다")
    void completeJob_success() {
        CrawlJob job = startedJob(JobType.FULL_CRAWL);

        CrawlJob completed = service.completeJob(job.getId(), JobResult.builder().success(true).totalProducts(3).build());

        assertEquals(JobStatus.COMPLETED, completed.getStatus());
        assertEquals("test-agent", completed.getExecution().getAgent());
        assertNotNull(completed.getExecution().getCompletedAt());
        assertTrue(completed.getExecution().getDurationSeconds() >= 0);
        assertEquals(3, completed.getResult().getTotalProducts());

        LedgerStats stats = service.getStats();
        assertNotNull(stats.getLastFullCrawl());
        assertNull(stats.getLastIncremental());
        assertEquals(1, stats.getJobs().getCompleted());
        assertNotNull(stats.getAverageCrawlTimeSeconds());
    }

    @Test
    @DisplayName("실패 결과로 종료하면 FAILED 가 되고 lastFullCrawl 은 기록되지 않는다")
    void completeJob_failure() {
        CrawlJob job = startedJob(JobType.FULL_CRAWL);

        CrawlJob failed = service.completeJob(job.getId(), JobResult.failure("interrupted"));

        assertEquals(JobStatus.FAILED, failed.getStatus());
        assertEquals("interrupted", failed.getResult().getErrorMessage());
        assertNull(service.getStats().getLastFullCrawl());
        assertEquals(1, service.getStats().getJobs().getFailed());
    }

    @Test
    @DisplayName("허용되지 않는 상태 전이는 IllegalStateException")
    void illegalTransitions() {
        CrawlJob pending = service.createJob(JobType.FULL_CRAWL, new JobConfig(), "medium");
        assertThrows(IllegalStateException.class,
                () -> service.completeJob(pending.getId(), JobResult.builder().success(true).build()));
        assertThrows(IllegalStateException.class, () -> service.pauseJob(pending.getId()));

        service.startJob(pending.getId(), "agent");
        service.completeJob(pending.getId(), JobResult.builder().success(true).build());
        assertThrows(IllegalStateException.class, () -> service.startJob(pending.getId(), "agent"));
        assertThrows(IllegalStateException.class, () -> service.resumeJob(pending.getId()));
    }

    @Test
    @DisplayName("실행 중인 작업은 일시 정지 후 재개할 수 있다")
    void pauseAndResume() {
        CrawlJob job = startedJob(JobType.FULL_CRAWL);

        service.pauseJob(job.getId());
        assertTrue(service.isPaused(job.getId()));
        assertEquals(1, service.getStats().getJobs().getPaused());

        service.resumeJob(job.getId());
        assertFalse(service.isPaused(job.getId()));
        assertEquals(1, service.getStats().getJobs().getInProgress());
    }

    @Test
    @DisplayName("없는 작업 ID 는 IllegalArgumentException")
    void unknownJob() {
        assertThrows(IllegalArgumentException.class, () -> service.startJob("JOB-999", "agent"));
        assertTrue(service.findJob("JOB-999").isEmpty());
    }

    // ===== 세션 =====

    @Test
    @DisplayName("세션이 없으면 진행 상황 갱신은 아무것도 하지 않는다")
    void updateProgress_withoutSession() {
        service.updateSessionProgress(SessionProgressUpdate.builder().productsCrawled(5).build());

        assertTrue(service.getCurrentSession().isEmpty());
        assertFalse(Files.exists(ledgerFile));
    }

    @Test
    @DisplayName("세션 진행 상황은 null 이 아닌 값만 반영된다")
    void sessionProgress_partialUpdate() {
        CrawlSession session = service.startSession("crawler-agent");
        assertTrue(session.getId().matches("SESSION-[0-9A-F]{8}"));
        assertEquals(JobStatus.IN_PROGRESS, session.getStatus());

        service.updateSessionProgress(SessionProgressUpdate.builder().productsDiscovered(40).currentPage(2).build());
        service.updateSessionProgress(SessionProgressUpdate.builder().productsCrawled(7).build());
        service.endSession(JobStatus.COMPLETED);

        CrawlSession current = service.getCurrentSession().orElseThrow();
        assertEquals(40, current.getProgress().getProductsDiscovered());
        assertEquals(2, current.getProgress().getCurrentPage());
        assertEquals(7, current.getProgress().getProductsCrawled());
        assertEquals(JobStatus.COMPLETED, current.getStatus());
    }

    // ===== 상품 =====

    @Test
    @DisplayName("같은 ID 로 여러 번 갱신해도 항목은 하나이고 병합 규칙대로 갱신된다")
    void addOrUpdateProduct_converges() {
        ProductEntry first = service.addOrUpdateProduct(update("classic-tee")
                .price("$19.99").category("T SHIRTS").imageCount(3).downloadedCount(3).build());
        LocalDateTime firstSeen = first.getCrawlInfo().getFirstSeen();

        ProductEntry second = service.addOrUpdateProduct(ProductUpdate.builder()
                .productId("classic-tee")
                .name("Renamed Tee")
                .url("https://ggstore.com/products/classic-tee?variant=2")
                .jobId("JOB-002")
                .status(JobStatus.FAILED)
                .imageCount(4).downloadedCount(2).failedCount(2)
                .category("SALE")
                .build());

        assertSame(first, second);
        assertEquals(1, service.getStats().getTotalProducts());
        assertEquals("Name classic-tee", second.getName());
        assertEquals("https://ggstore.com/products/classic-tee", second.getUrl());
        assertEquals(2, second.getCrawlInfo().getCrawlCount());
        assertEquals(firstSeen, second.getCrawlInfo().getFirstSeen());
        assertEquals("JOB-002", second.getCrawlInfo().getJobId());
        assertEquals("$19.99", second.getPrice().getCurrent());
        assertEquals("SALE", second.getCategory());
        assertEquals(JobStatus.FAILED, second.getImages().getStatus());
        assertEquals(2, second.getImages().getDownloaded());
    }

    @Test
    @DisplayName("통계는 항상 장부 내용과 일치한다")
    void stats_matchLedgerContents() {
        service.addOrUpdateProduct(update("a").category("TEES").downloadedCount(2).imageCount(2).build());
        service.addOrUpdateProduct(update("b").category("TEES").downloadedCount(1).imageCount(3).failedCount(2).build());
        service.addOrUpdateProduct(update("c").downloadedCount(4).imageCount(4).build());
        service.addOrUpdateProduct(update("a").category("HATS").downloadedCount(3).imageCount(3).build());
        startedJob(JobType.FULL_CRAWL);
        service.createJob(JobType.INCREMENTAL, new JobConfig(), "low");

        LedgerStats stats = service.getStats();

        assertEquals(3, stats.getTotalProducts());
        assertEquals(8, stats.getTotalImages());
        assertEquals(8, stats.getDownloads().getSuccessful());
        assertEquals(2, stats.getDownloads().getFailed());
        assertEquals(Integer.valueOf(1), stats.getByCategory().get("TEES"));
        assertEquals(Integer.valueOf(1), stats.getByCategory().get("HATS"));
        assertEquals(2, stats.getJobs().getTotal());
        assertEquals(1, stats.getJobs().getInProgress());
        assertEquals(1, stats.getJobs().getPending());
    }

    @Test
    @DisplayName("이미지 다운로드에 실패한 상품을 조회할 수 있다")
    void getFailedProducts() {
        service.addOrUpdateProduct(update("ok").build());
        service.addOrUpdateProduct(update("broken").status(JobStatus.FAILED).imageCount(2).failedCount(2).build());

        List<String> ids = service.getFailedProducts().stream().map(ProductEntry::getId).collect(Collectors.toList());

        assertEquals(List.of("broken"), ids);
    }

    // ===== 오류 =====

    @Test
    @DisplayName("오류는 ERR-001 부터 기록되고, 상품 항목에도 메시지가 쌓인다")
    void logError_appendsToProduct() {
        service.addOrUpdateProduct(update("classic-tee").build());

        ErrorEntry first = service.logError("JOB-001", ErrorType.TIMEOUT, "시간 초과", "classic-tee",
                "https://ggstore.com/products/classic-tee");
        ErrorEntry second = service.logError("JOB-001", ErrorType.CRAWL_FAILED, "접속 실패", "unknown-item", null);

        assertEquals("ERR-001", first.getId());
        assertEquals("ERR-002", second.getId());
        assertEquals(List.of("시간 초과"), service.findProduct("classic-tee").orElseThrow().getErrors());
        assertEquals(2, service.getUnresolvedErrors().size());
    }

    @Test
    @DisplayName("오류 해결 처리는 여러 번 해도 같고, 없는 ID 는 false")
    void resolveError_isIdempotent() {
        ErrorEntry error = service.logError("JOB-001", ErrorType.PARSE_FAILED, "정보 없음", "x", "u");

        assertTrue(service.resolveError(error.getId()));
        assertTrue(service.resolveError(error.getId()));
        assertFalse(service.resolveError("ERR-404"));
        assertTrue(service.getUnresolvedErrors().isEmpty());
        assertEquals(1, service.getErrors().size());
    }

    @Test
    @DisplayName("상품 단위로 미해결 오류를 해결하고, 재시도 횟수를 올릴 수 있다")
    void resolveErrorsForProduct_andRetryCount() {
        ErrorEntry a1 = service.logError("JOB-001", ErrorType.TIMEOUT, "t", "a", "ua");
        service.logError("JOB-001", ErrorType.CRAWL_FAILED, "c", "a", "ua");
        ErrorEntry b = service.logError("JOB-001", ErrorType.CRAWL_FAILED, "c", "b", "ub");

        service.incrementRetryCount(b.getId());
        service.incrementRetryCount(b.getId());

        assertEquals(2, service.resolveErrorsForProduct("a"));
        assertEquals(0, service.resolveErrorsForProduct("a"));
        assertEquals(List.of(b.getId()),
                service.getUnresolvedErrors().stream().map(ErrorEntry::getId).collect(Collectors.toList()));
        assertEquals(2, service.getUnresolvedErrors().get(0).getRetryCount());
        assertNotEquals(a1.getId(), b.getId());
    }

    // ===== 메타데이터 동기화 =====

    @Test
    @DisplayName("메타데이터 동기화 상태를 판정한다")
    void metadataSync() {
        service.addOrUpdateProduct(update("a").build());
        assertEquals(MetadataSyncStatus.NEEDS_REBUILD, service.checkMetadataSync(null));

        CrawlResult result = new CrawlResult(LocalDateTime.now());
        result.addProduct(Product.builder().id("a").name("A").url("u").build());
        service.syncFromMetadata(result, "data/metadata.json");
        assertEquals(MetadataSyncStatus.IN_SYNC, service.checkMetadataSync(result));

        result.addProduct(Product.builder().id("b").name("B").url("u").build());
        assertEquals(MetadataSyncStatus.OUT_OF_SYNC, service.checkMetadataSync(result));
        assertEquals(1, service.getSummary().getMetadataSync().getProductsInMetadata());
    }

    // ===== 재시작 =====

    @Test
    @DisplayName("다시 열면 저장된 작업/상품/오류/세션을 그대로 이어받는다")
    void reload_restoresState() {
        service.startSession("crawler-agent");
        CrawlJob job = startedJob(JobType.FULL_CRAWL);
        service.addOrUpdateProduct(update("classic-tee").price("$19.99").build());
        service.logError(job.getId(), ErrorType.TIMEOUT, "시간 초과", "classic-tee", "u");

        CrawlLedgerService reopened = new CrawlLedgerService(new LedgerRepository(), ledgerFile);

        assertEquals(JobStatus.IN_PROGRESS, reopened.findJob(job.getId()).orElseThrow().getStatus());
        assertEquals("$19.99", reopened.findProduct("classic-tee").orElseThrow().getPrice().getCurrent());
        assertEquals(1, reopened.getUnresolvedErrors().size());
        assertEquals(service.getCurrentSession().orElseThrow().getId(),
                reopened.getCurrentSession().orElseThrow().getId());
        assertEquals("JOB-002", reopened.createJob(JobType.INCREMENTAL, new JobConfig(), "low").getId());
    }

    @Test
    @DisplayName("상태 출력에는 프로젝트명과 통계가 포함된다")
    void formatStatus() {
        service.addOrUpdateProduct(update("a").downloadedCount(2).imageCount(2).build());
        service.logError("JOB-001", ErrorType.TIMEOUT, "t", "a", "u");

        String status = service.formatStatus();

        assertTrue(status.contains("ggp_store_parser"));
        assertTrue(status.contains("상품: 1"));
        assertTrue(status.contains("이미지: 2"));
        assertTrue(status.contains("미해결 1건"));
        assertTrue(status.contains("진행 중인 세션 없음"));
    }

    @Test
    @DisplayName("조회 결과는 복사본이라 바꿔도 장부에 반영되지 않는다")
    void readViews_areCopies() {
        service.startSession("crawler-agent");
        service.updateSessionProgress(SessionProgressUpdate.builder().productsCrawled(3).build());
        startedJob(JobType.FULL_CRAWL);

        LedgerSummary summary = service.getSummary();
        summary.getCurrentSession().getProgress().setProductsCrawled(99);
        summary.getStats().getJobs().setTotal(99);
        summary.getMetadataSync().setProductsInMetadata(99);
        service.getCurrentSession().orElseThrow().setStatus(JobStatus.FAILED);
        service.getStats().setTotalProducts(99);

        CrawlSession current = service.getCurrentSession().orElseThrow();
        assertNotSame(current, service.getCurrentSession().orElseThrow());
        assertEquals(3, current.getProgress().getProductsCrawled());
        assertEquals(JobStatus.IN_PROGRESS, current.getStatus());
        assertEquals(1, service.getStats().getJobs().getTotal());
        assertEquals(0, service.getStats().getTotalProducts());
        assertEquals(0, service.getSummary().getMetadataSync().getProductsInMetadata());
    }
}
