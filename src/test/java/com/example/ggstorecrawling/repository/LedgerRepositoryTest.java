package com.example.ggstorecrawling.repository;

import com.example.ggstorecrawling.entity.ErrorType;
import com.example.ggstorecrawling.entity.JobStatus;
import com.example.ggstorecrawling.entity.JobType;
import com.example.ggstorecrawling.ledger.CrawlJob;
import com.example.ggstorecrawling.ledger.CrawlLedger;
import com.example.ggstorecrawling.ledger.ErrorEntry;
import com.example.ggstorecrawling.ledger.ProductEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LedgerRepository 테스트")
class LedgerRepositoryTest {

    @TempDir
    Path tempDir;

    private final LedgerRepository repository = new LedgerRepository();

    @Test
    @DisplayName("파일이 없으면 기본값을 가진 새 장부를 반환한다")
    void missingFile_startsEmptyLedger() {
        CrawlLedger ledger = repository.load(tempDir.resolve("store_parser_checklist.yaml"));

        assertEquals("ggp_store_parser", ledger.getProject());
        assertEquals("https://ggstore.com", ledger.getTargetSite());
        assertTrue(ledger.getJobs().isEmpty());
        assertTrue(ledger.getProducts().isEmpty());
        assertNull(ledger.getCurrentSession());
    }

    @Test
    @DisplayName("YAML 로 저장한 장부를 다시 읽으면 작업/상품/오류가 그대로 복원된다")
    void saveAndLoad() throws IOException {
        Path file = tempDir.resolve("store_parser_checklist.yaml");
        CrawlLedger ledger = new CrawlLedger();

        CrawlJob job = CrawlJob.builder().id("JOB-001").type(JobType.INCREMENTAL).priority("high").build();
        job.setStatus(JobStatus.IN_PROGRESS);
        job.getExecution().setStartedAt(LocalDateTime.of(2024, 5, 1, 9, 30));
        ledger.getJobs().add(job);

        ProductEntry product = new ProductEntry();
        product.setId("classic-tee");
        product.setName("Classic Tee");
        product.setUrl("https://ggstore.com/products/classic-tee");
        product.getPrice().setCurrent("$19.99");
        product.getImages().setDownloaded(3);
        ledger.getProducts().put(product.getId(), product);

        ledger.getErrors().add(ErrorEntry.builder()
                .id("ERR-001")
                .jobId("JOB-001")
                .productId("classic-tee")
                .type(ErrorType.TIMEOUT)
                .message("페이지 로딩 시간 초과: https://ggstore.com/products/classic-tee")
                .timestamp(LocalDateTime.of(2024, 5, 1, 9, 31))
                .build());

        repository.save(ledger, file);
        String yaml = Files.readString(file, StandardCharsets.UTF_8);
        CrawlLedger loaded = repository.load(file);

        assertTrue(yaml.contains("status: in_progress"));
        assertTrue(yaml.contains("target_site:"));
        assertFalse(Files.exists(tempDir.resolve("store_parser_checklist.yaml.tmp")));

        CrawlJob loadedJob = loaded.findJob("JOB-001").orElseThrow();
        assertEquals(JobType.INCREMENTAL, loadedJob.getType());
        assertEquals(JobStatus.IN_PROGRESS, loadedJob.getStatus());
        assertEquals("high", loadedJob.getPriority());
        assertEquals(LocalDateTime.of(2024, 5, 1, 9, 30), loadedJob.getExecution().getStartedAt());

        ProductEntry loadedProduct = loaded.findProduct("classic-tee").orElseThrow();
        assertEquals("$19.99", loadedProduct.getPrice().getCurrent());
        assertEquals(3, loadedProduct.getImages().getDownloaded());

        ErrorEntry loadedError = loaded.findError("ERR-001").orElseThrow();
        assertEquals(ErrorType.TIMEOUT, loadedError.getType());
        assertFalse(loadedError.isResolved());
        assertEquals(error(ledger).getMessage(), loadedError.getMessage());
    }

    @Test
    @DisplayName("깨진 장부 파일은 덮어쓰지 않도록 예외를 던진다")
    void corruptFile_throws() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "jobs: [unclosed\n  - {", StandardCharsets.UTF_8);

        assertThrows(StorageException.class, () -> repository.load(file));
    }

    private static ErrorEntry error(CrawlLedger ledger) {
        return ledger.getErrors().get(0);
    }
}
