package com.example.ggstorecrawling.service;

import com.example.ggstorecrawling.config.CrawlerProperties;
import com.example.ggstorecrawling.entity.CrawlResult;
import com.example.ggstorecrawling.entity.ErrorType;
import com.example.ggstorecrawling.entity.JobStatus;
import com.example.ggstorecrawling.entity.JobType;
import com.example.ggstorecrawling.ledger.CrawlJob;
import com.example.ggstorecrawling.ledger.CrawlLedger;
import com.example.ggstorecrawling.ledger.CrawlSession;
import com.example.ggstorecrawling.ledger.ErrorEntry;
import com.example.ggstorecrawling.ledger.JobConfig;
import com.example.ggstorecrawling.ledger.JobResult;
import com.example.ggstorecrawling.ledger.LedgerStats;
import com.example.ggstorecrawling.ledger.LedgerSummary;
import com.example.ggstorecrawling.ledger.MetadataSync;
import com.example.ggstorecrawling.ledger.MetadataSyncStatus;
import com.example.ggstorecrawling.ledger.ProductEntry;
import com.example.ggstorecrawling.ledger.ProductUpdate;
import com.example.ggstorecrawling.ledger.SessionProgressUpdate;
import com.example.ggstorecrawling.repository.LedgerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 크롤링 장부(체크리스트) 관리 서비스
 *
 * 작업(Job), 세션, 상품별 이력, 오류 로그를 하나의 YAML 파일로 관리합니다.
 * - 모든 변경은 즉시 파일 전체를 다시 저장합니다 (중간에 종료되어도 마지막 변경까지 남음)
 * - 통계는 변경이 있을 때마다 컬렉션에서 새로 계산합니다 (누적 방식이 아니므로 어긋나지 않음)
 * - 쓰기는 한 번에 하나의 스레드만 (synchronized)
 */
@Slf4j
@Service
public class CrawlLedgerService {

    private final LedgerRepository ledgerRepository;
    private Path ledgerFile;
    private CrawlLedger ledger;

    @Autowired
    public CrawlLedgerService(LedgerRepository ledgerRepository, CrawlerProperties properties) {
        this(ledgerRepository, Paths.get(properties.getStorage().getChecklistFile()));
    }

    public CrawlLedgerService(LedgerRepository ledgerRepository, Path ledgerFile) {
        this.ledgerRepository = ledgerRepository;
        this.ledgerFile = ledgerFile;
    }

    /**
     * 다른 장부 파일로 전환합니다 (CLI 의 --checklist 옵션).
     */
    public synchronized void open(Path ledgerFile) {
        this.ledgerFile = ledgerFile;
        this.ledger = ledgerRepository.load(ledgerFile);
        log.info("장부 로드: {} (작업 {}건, 상품 {}개)", ledgerFile, ledger.getJobs().size(), ledger.getProducts().size());
    }

    /**
     * 파일에서 다시 읽습니다. 메모리의 변경 사항은 모두 저장된 상태이므로 잃는 것이 없습니다.
     */
    public synchronized void reload() {
        open(ledgerFile);
    }

    public synchronized Path getLedgerFile() {
        return ledgerFile;
    }

    private CrawlLedger ledger() {
        if (ledger == null) {
            ledger = ledgerRepository.load(ledgerFile);
        }
        return ledger;
    }

    private void save() {
        recalculateStats();
        ledgerRepository.save(ledger(), ledgerFile);
    }

    // ===================== 세션 =====================

    /**
     * 새 세션 시작. 이전 세션은 통째로 교체됩니다.
     */
    public synchronized CrawlSession startSession(String agent) {
        CrawlSession session = CrawlSession.builder()
                .id("SESSION-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT))
                .startedAt(LocalDateTime.now())
                .status(JobStatus.IN_PROGRESS)
                .agent(agent)
                .build();
        ledger().setCurrentSession(session);
        save();
        log.info("세션 시작: {} ({})", session.getId(), agent);
        return session;
    }

    /**
     * 세션 진행 상황 갱신. 세션이 없으면 아무것도 하지 않습니다.
     */
    public synchronized void updateSessionProgress(SessionProgressUpdate update) {
        CrawlSession session = ledger().getCurrentSession();
        if (session == null) {
            return;
        }
        update.applyTo(session.getProgress());
        save();
    }

    public synchronized void endSession(JobStatus status) {
        CrawlSession session = ledger().getCurrentSession();
        if (session == null) {
            return;
        }
        session.setStatus(status);
        save();
        log.info("세션 종료: {} → {}", session.getId(), status.getValue());
    }

    /** 현재 세션의 복사본 (세션이 없으면 빈 값) */
    public synchronized Optional<CrawlSession> getCurrentSession() {
        return Optional.ofNullable(ledgerRepository.copyOf(ledger().getCurrentSession(), CrawlSession.class));
    }

    // ===================== 작업(Job) =====================

    public synchronized CrawlJob createJob(JobType type, JobConfig config, String priority) {
        CrawlJob job = CrawlJob.builder()
                .id(String.format("JOB-%03d", ledger().getJobs().size() + 1))
                .type(type)
                .priority(priority)
                .config(config)
                .build();
        ledger().getJobs().add(job);
        save();
        log.info("작업 생성: {} ({})", job.getId(), type.getValue());
        return job;
    }

    public synchronized CrawlJob startJob(String jobId, String agent) {
        CrawlJob job = requireJob(jobId);
        transition(job, JobStatus.IN_PROGRESS);
        job.getExecution().setAgent(agent);
        job.getExecution().setStartedAt(LocalDateTime.now());
        save();
        log.info("작업 시작: {}", jobId);
        return job;
    }

    /**
     * 작업 종료. result.success 에 따라 COMPLETED 또는 FAILED 가 됩니다.
     */
    public synchronized CrawlJob completeJob(String jobId, JobResult result) {
        CrawlJob job = requireJob(jobId);
        transition(job, result.isSuccess() ? JobStatus.COMPLETED : JobStatus.FAILED);

        LocalDateTime now = LocalDateTime.now();
        job.getExecution().setCompletedAt(now);
        if (job.getExecution().getStartedAt() != null) {
            job.getExecution().setDurationSeconds(Duration.between(job.getExecution().getStartedAt(), now).getSeconds());
        }
        job.setResult(result);

        if (result.isSuccess()) {
            if (job.getType() == JobType.FULL_CRAWL) {
                ledger().getStats().setLastFullCrawl(now);
            } else if (job.getType() == JobType.INCREMENTAL) {
                ledger().getStats().setLastIncremental(now);
            }
        }
        save();
        log.info("작업 종료: {} → {}", jobId, job.getStatus().getValue());
        return job;
    }

    public synchronized CrawlJob pauseJob(String jobId) {
        CrawlJob job = requireJob(jobId);
        transition(job, JobStatus.PAUSED);
        save();
        log.info("작업 일시 정지: {}", jobId);
        return job;
    }

    public synchronized CrawlJob resumeJob(String jobId) {
        CrawlJob job = requireJob(jobId);
        transition(job, JobStatus.IN_PROGRESS);
        save();
        log.info("작업 재개: {}", jobId);
        return job;
    }

    public synchronized Optional<CrawlJob> findJob(String jobId) {
        return ledger().findJob(jobId);
    }

    public synchronized boolean isPaused(String jobId) {
        return ledger().findJob(jobId).map(job -> job.getStatus() == JobStatus.PAUSED).orElse(false);
    }

    public synchronized List<CrawlJob> getJobs() {
        return new ArrayList<>(ledger().getJobs());
    }

    public synchronized List<CrawlJob> getPendingJobs() {
        return ledger().getJobs().stream()
                .filter(job -> job.getStatus() == JobStatus.PENDING)
                .collect(Collectors.toList());
    }

    private CrawlJob requireJob(String jobId) {
        return ledger().findJob(jobId)
                .orElseThrow(() -> new IllegalArgumentException("작업을 찾을 수 없습니다: " + jobId));
    }

    private static void transition(CrawlJob job, JobStatus next) {
        if (!job.getStatus().canTransitionTo(next)) {
            throw new IllegalStateException(String.format("작업 %s 는 %s 에서 %s 로 바꿀 수 없습니다.",
                    job.getId(), job.getStatus().getValue(), next.getValue()));
        }
        job.setStatus(next);
    }

    // ===================== 상품 =====================

    /**
     * 상품 항목 추가/갱신
     *
     * 같은 ID 가 있으면 제자리에서 갱신합니다:
     * - 상태, 이미지 수, 작업 ID 는 마지막 값으로
     * - crawlCount + 1, lastCrawled 갱신, firstSeen 유지
     * - 가격/카테고리는 새 값이 있을 때만 교체
     * - 이름/URL 은 처음 본 값 유지
     */
    public synchronized ProductEntry addOrUpdateProduct(ProductUpdate update) {
        LocalDateTime now = LocalDateTime.now();
        ProductEntry entry = ledger().getProducts().get(update.getProductId());

        if (entry == null) {
            entry = new ProductEntry();
            entry.setId(update.getProductId());
            entry.setName(update.getName());
            entry.setUrl(update.getUrl());
            ProductEntry.CrawlInfo crawlInfo = new ProductEntry.CrawlInfo();
            crawlInfo.setFirstSeen(now);
            crawlInfo.setLastCrawled(now);
            crawlInfo.setCrawlCount(1);
            crawlInfo.setJobId(update.getJobId());
            entry.setCrawlInfo(crawlInfo);
            ledger().getProducts().put(entry.getId(), entry);
        } else {
            ProductEntry.CrawlInfo crawlInfo = entry.getCrawlInfo();
            if (crawlInfo == null) {
                crawlInfo = new ProductEntry.CrawlInfo();
                crawlInfo.setFirstSeen(now);
                crawlInfo.setCrawlCount(0);
                entry.setCrawlInfo(crawlInfo);
            }
            crawlInfo.setLastCrawled(now);
            crawlInfo.setCrawlCount(crawlInfo.getCrawlCount() + 1);
            crawlInfo.setJobId(update.getJobId());
        }

        entry.setStatus(update.getStatus());
        entry.getImages().setTotal(update.getImageCount());
        entry.getImages().setDownloaded(update.getDownloadedCount());
        entry.getImages().setFailed(update.getFailedCount());
        entry.getImages().setStatus(update.getStatus());
        if (update.getPrice() != null) {
            entry.getPrice().setCurrent(update.getPrice());
            entry.getPrice().setLastSeen(now);
        }
        if (update.getCategory() != null) {
            entry.setCategory(update.getCategory());
        }

        save();
        return entry;
    }

    public synchronized Optional<ProductEntry> findProduct(String productId) {
        return ledger().findProduct(productId);
    }

    /**
     * 처리에 실패했거나 이미지 다운로드가 실패한 상품
     */
    public synchronized List<ProductEntry> getFailedProducts() {
        return ledger().getProducts().values().stream()
                .filter(p -> p.getStatus() == JobStatus.FAILED || p.getImages().getStatus() == JobStatus.FAILED)
                .collect(Collectors.toList());
    }

    // ===================== 오류 =====================

    /**
     * 오류 기록. 상품 ID 가 장부에 있으면 그 상품의 오류 목록에도 메시지를 남깁니다.
     */
    public synchronized ErrorEntry logError(String jobId, ErrorType type, String message, String productId, String url) {
        ErrorEntry error = ErrorEntry.builder()
                .id(String.format("ERR-%03d", ledger().getErrors().size() + 1))
                .timestamp(LocalDateTime.now())
                .jobId(jobId)
                .productId(productId)
                .type(type)
                .url(url)
                .message(message)
                .build();
        ledger().getErrors().add(error);
        if (productId != null) {
            ledger().findProduct(productId).ifPresent(p -> p.getErrors().add(message));
        }
        save();
        log.warn("오류 기록 {}: [{}] {} - {}", error.getId(), type.getValue(), url, message);
        return error;
    }

    public synchronized List<ErrorEntry> getErrors() {
        return new ArrayList<>(ledger().getErrors());
    }

    public synchronized List<ErrorEntry> getUnresolvedErrors() {
        return ledger().getErrors().stream()
                .filter(e -> !e.isResolved())
                .collect(Collectors.toList());
    }

    /**
     * 오류를 해결됨으로 표시. 이미 해결된 오류도 true 를 반환합니다.
     *
     * @return 오류 ID 가 존재하면 true
     */
    public synchronized boolean resolveError(String errorId) {
        Optional<ErrorEntry> error = ledger().findError(errorId);
        if (error.isEmpty()) {
            return false;
        }
        if (!error.get().isResolved()) {
            error.get().setResolved(true);
            save();
        }
        return true;
    }

    /**
     * 상품의 미해결 오류를 모두 해결 처리합니다 (재시도 성공 시).
     *
     * @return 해결 처리한 개수
     */
    public synchronized int resolveErrorsForProduct(String productId) {
        int resolved = 0;
        for (ErrorEntry error : ledger().getErrors()) {
            if (!error.isResolved() && productId.equals(error.getProductId())) {
                error.setResolved(true);
                resolved++;
            }
        }
        if (resolved > 0) {
            save();
        }
        return resolved;
    }

    public synchronized void incrementRetryCount(String errorId) {
        ErrorEntry error = ledger().findError(errorId)
                .orElseThrow(() -> new IllegalArgumentException("오류를 찾을 수 없습니다: " + errorId));
        error.setRetryCount(error.getRetryCount() + 1);
        save();
    }

    // ===================== 메타데이터 동기화 =====================

    /**
     * metadata.json 의 현재 내용을 동기화 기록으로 남깁니다.
     */
    public synchronized void syncFromMetadata(CrawlResult result, String metadataFile) {
        MetadataSync sync = ledger().getMetadataSync();
        if (metadataFile != null) {
            sync.setFile(metadataFile);
        }
        sync.setLastSync(LocalDateTime.now());
        sync.setProductsInMetadata(result.getTotalProducts());
        sync.setImagesInMetadata(result.getTotalImages());
        sync.setSyncStatus(MetadataSyncStatus.IN_SYNC);
        save();
    }

    /**
     * metadata.json 과 장부가 맞는지 확인합니다.
     *
     * @param result 현재 메타데이터 (파일이 없으면 null)
     */
    public synchronized MetadataSyncStatus checkMetadataSync(CrawlResult result) {
        MetadataSync sync = ledger().getMetadataSync();
        MetadataSyncStatus status;
        if (result == null) {
            status = ledger().getProducts().isEmpty() ? MetadataSyncStatus.IN_SYNC : MetadataSyncStatus.NEEDS_REBUILD;
        } else if (result.getTotalProducts() != sync.getProductsInMetadata()
                || result.getTotalImages() != sync.getImagesInMetadata()) {
            status = MetadataSyncStatus.OUT_OF_SYNC;
        } else {
            status = MetadataSyncStatus.IN_SYNC;
        }
        if (status != sync.getSyncStatus()) {
            log.warn("메타데이터 동기화 상태 변경: {} → {}", sync.getSyncStatus().getValue(), status.getValue());
        }
        sync.setSyncStatus(status);
        save();
        return status;
    }

    // ===================== 통계 / 요약 =====================

    private void recalculateStats() {
        CrawlLedger current = ledger();
        LedgerStats stats = current.getStats();

        stats.setTotalProducts(current.getProducts().size());
        stats.setTotalImages(current.getProducts().values().stream()
                .mapToInt(p -> p.getImages().getDownloaded()).sum());

        LedgerStats.JobStats jobStats = stats.getJobs();
        List<CrawlJob> jobs = current.getJobs();
        jobStats.setTotal(jobs.size());
        jobStats.setCompleted(countJobs(jobs, JobStatus.COMPLETED));
        jobStats.setFailed(countJobs(jobs, JobStatus.FAILED));
        jobStats.setPending(countJobs(jobs, JobStatus.PENDING));
        jobStats.setInProgress(countJobs(jobs, JobStatus.IN_PROGRESS));
        jobStats.setPaused(countJobs(jobs, JobStatus.PAUSED));

        LedgerStats.DownloadStats downloads = stats.getDownloads();
        downloads.setSuccessful(stats.getTotalImages());
        downloads.setFailed(current.getProducts().values().stream()
                .mapToInt(p -> p.getImages().getFailed()).sum());
        downloads.setSkipped(jobs.stream()
                .map(CrawlJob::getResult)
                .filter(Objects::nonNull)
                .mapToInt(JobResult::getSkippedProducts)
                .sum());

        Map<String, Integer> byCategory = new TreeMap<>();
        for (ProductEntry product : current.getProducts().values()) {
            if (product.getCategory() != null) {
                byCategory.merge(product.getCategory(), 1, Integer::sum);
            }
        }
        stats.setByCategory(byCategory);

        OptionalDouble average = jobs.stream()
                .filter(job -> job.getStatus() == JobStatus.COMPLETED)
                .map(job -> job.getExecution().getDurationSeconds())
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average();
        stats.setAverageCrawlTimeSeconds(average.isPresent() ? Math.round(average.getAsDouble()) : null);
    }

    private static int countJobs(List<CrawlJob> jobs, JobStatus status) {
        return (int) jobs.stream().filter(job -> job.getStatus() == status).count();
    }

    /** 통계의 복사본 */
    public synchronized LedgerStats getStats() {
        recalculateStats();
        return ledgerRepository.copyOf(ledger().getStats(), LedgerStats.class);
    }

    public synchronized LedgerSummary getSummary() {
        recalculateStats();
        CrawlLedger current = ledger();
        return LedgerSummary.builder()
                .project(current.getProject())
                .targetSite(current.getTargetSite())
                .updatedAt(current.getUpdatedAt())
                .currentSession(ledgerRepository.copyOf(current.getCurrentSession(), CrawlSession.class))
                .stats(ledgerRepository.copyOf(current.getStats(), LedgerStats.class))
                .errorsCount(current.getErrors().size())
                .unresolvedErrors(getUnresolvedErrors().size())
                .metadataSync(ledgerRepository.copyOf(current.getMetadataSync(), MetadataSync.class))
                .build();
    }

    /**
     * 사람이 읽기 위한 상태 출력 문자열
     */
    public synchronized String formatStatus() {
        LedgerSummary summary = getSummary();
        CrawlSession session = summary.getCurrentSession();
        LedgerStats stats = summary.getStats();
        MetadataSync sync = summary.getMetadataSync();

        StringBuilder sb = new StringBuilder();
        sb.append("=== ").append(summary.getProject()).append(" 체크리스트 상태 ===\n");
        sb.append("대상: ").append(summary.getTargetSite()).append('\n');
        sb.append("갱신: ").append(summary.getUpdatedAt()).append("\n\n");
        sb.append("세션:\n");
        sb.append("  ID: ").append(session == null ? "없음" : session.getId()).append('\n');
        sb.append("  상태: ").append(session == null ? "진행 중인 세션 없음" : session.getStatus().getValue()).append('\n');
        if (session != null) {
            sb.append("  진행: 발견 ").append(session.getProgress().getProductsDiscovered())
                    .append(" / 처리 ").append(session.getProgress().getProductsCrawled())
                    .append(" / 건너뜀 ").append(session.getProgress().getProductsSkipped())
                    .append(" (페이지 ").append(session.getProgress().getCurrentPage()).append(")\n");
        }
        sb.append('\n');
        sb.append("통계:\n");
        sb.append("  상품: ").append(stats.getTotalProducts()).append('\n');
        sb.append("  이미지: ").append(stats.getTotalImages()).append('\n');
        sb.append("  작업: ").append(stats.getJobs().getCompleted()).append('/').append(stats.getJobs().getTotal())
                .append(" (실패 ").append(stats.getJobs().getFailed()).append(")\n");
        sb.append("  오류: 미해결 ").append(summary.getUnresolvedErrors()).append("건\n\n");
        sb.append("메타데이터 동기화:\n");
        sb.append("  상태: ").append(sync.getSyncStatus().getValue()).append('\n');
        sb.append("  마지막 동기화: ").append(sync.getLastSync() == null ? "없음" : sync.getLastSync());
        return sb.toString();
    }
}
