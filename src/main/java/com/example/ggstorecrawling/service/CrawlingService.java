package com.example.ggstorecrawling.service;

import com.example.ggstorecrawling.client.PageRenderTimeoutException;
import com.example.ggstorecrawling.client.PageRenderer;
import com.example.ggstorecrawling.client.PageRendererFactory;
import com.example.ggstorecrawling.config.CrawlerProperties;
import com.example.ggstorecrawling.entity.CrawlResult;
import com.example.ggstorecrawling.entity.ErrorType;
import com.example.ggstorecrawling.entity.JobStatus;
import com.example.ggstorecrawling.entity.JobType;
import com.example.ggstorecrawling.entity.Product;
import com.example.ggstorecrawling.entity.ProductCandidate;
import com.example.ggstorecrawling.entity.ProductImage;
import com.example.ggstorecrawling.ledger.CrawlJob;
import com.example.ggstorecrawling.ledger.ErrorEntry;
import com.example.ggstorecrawling.ledger.JobConfig;
import com.example.ggstorecrawling.ledger.JobResult;
import com.example.ggstorecrawling.ledger.ProductEntry;
import com.example.ggstorecrawling.ledger.ProductUpdate;
import com.example.ggstorecrawling.ledger.SessionProgressUpdate;
import com.example.ggstorecrawling.repository.MetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 크롤링 서비스 클래스
 *
 * GGStore 상품 크롤링의 전체 흐름을 담당합니다.
 *
 * 주요 기능:
 * 1. 상품 목록 탐색: /collections/all?page=N 을 차례로 열어 상품 URL 수집
 * 2. 상품 처리: 페이지 렌더링 → 파싱 → 이미지 다운로드 → 메타데이터/장부 기록
 * 3. 작업 관리: 작업 생성/시작/종료, 세션 진행 현황, 오류 기록
 *
 * 안정성:
 * - 상품 하나가 실패해도 오류만 기록하고 다음 상품으로 진행
 * - 상품 N 개를 처리할 때마다 metadata.json 중간 저장 (실패하거나 건너뛴 상품도 센다)
 * - 이미 다운로드된 상품은 건너뛰기 (재실행 시 이어서 진행)
 * - 한 번에 하나의 크롤링만 실행
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrawlingService {

    private static final String INTERRUPTED_MESSAGE = "interrupted";

    private final CrawlerProperties properties;
    private final PageRendererFactory pageRendererFactory;
    private final ProductPageParser productPageParser;
    private final ImageDownloadService imageDownloadService;
    private final MetadataRepository metadataRepository;
    private final CrawlLedgerService ledgerService;

    /** 실행 중인 크롤링 여부 (동시에 하나만 허용) */
    private final AtomicBoolean running = new AtomicBoolean(false);

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 크롤링을 현재 스레드에서 끝까지 실행합니다 (CLI).
     *
     * @return 작업 결과
     * @throws IllegalStateException 이미 실행 중인 크롤링이 있을 때
     */
    public JobResult run(CrawlRequest request) {
        CrawlJob job = reserve(request);
        return execute(job);
    }

    /**
     * 크롤링을 별도 스레드에서 시작하고 생성된 작업을 바로 반환합니다 (REST).
     * 진행 상황은 장부(GET /status)로 확인합니다.
     *
     * @throws IllegalStateException 이미 실행 중인 크롤링이 있을 때
     */
    public CrawlJob startAsync(CrawlRequest request) {
        CrawlJob job = reserve(request);
        Thread worker = new Thread(() -> {
            try {
                execute(job);
            } catch (RuntimeException e) {
                log.error("크롤링 작업 {} 이 실패했습니다.", job.getId(), e);
            }
        }, "crawl-" + job.getId());
        worker.start();
        return job;
    }

    /**
     * 실행 권한을 얻고 작업을 PENDING 상태로 장부에 등록합니다.
     */
    private CrawlJob reserve(CrawlRequest request) {
        JobConfig config = resolveConfig(request);
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("이미 실행 중인 크롤링 작업이 있습니다.");
        }
        try {
            return ledgerService.createJob(request.getType(), config, request.getPriority());
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
    }

    /**
     * 요청값과 기본 설정으로 작업 설정 스냅샷을 만듭니다.
     * - INCREMENTAL: 건너뛰기 강제 사용
     * - RETRY_FAILED, SINGLE_PRODUCT: 건너뛰기 사용 안 함 (대상이 명시적이므로)
     */
    JobConfig resolveConfig(CrawlRequest request) {
        JobConfig config = properties.toJobConfig();
        if (request.getOutputDir() != null) config.setOutputDir(request.getOutputDir());
        if (request.getMetadataFile() != null) config.setMetadataFile(request.getMetadataFile());
        if (request.getDelaySeconds() != null) config.setDelaySeconds(request.getDelaySeconds());
        if (request.getHeadless() != null) config.setHeadless(request.getHeadless());
        if (request.getSkipExisting() != null) config.setSkipExisting(request.getSkipExisting());

        if (config.getDelaySeconds() < 0) {
            throw new IllegalArgumentException("대기 시간은 0 이상이어야 합니다: " + config.getDelaySeconds());
        }

        switch (request.getType()) {
            case INCREMENTAL:
                config.setSkipExisting(true);
                break;
            case RETRY_FAILED:
                config.setSkipExisting(false);
                break;
            case SINGLE_PRODUCT:
                if (request.getTargetUrl() == null || request.getTargetUrl().isBlank()) {
                    throw new IllegalArgumentException("단일 상품 크롤링에는 상품 URL 이 필요합니다.");
                }
                config.setTargetUrl(request.getTargetUrl().trim());
                config.setSkipExisting(false);
                break;
            default:
                break;
        }
        return config;
    }

    /**
     * 작업 실행 본체. 어떤 경우에도 끝나면 실행 권한을 돌려놓습니다.
     */
    private JobResult execute(CrawlJob job) {
        String jobId = job.getId();
        JobConfig config = job.getConfig();
        Path outputDir = Paths.get(config.getOutputDir());
        Path metadataFile = Paths.get(config.getMetadataFile());
        RunCounters counters = new RunCounters();

        try {
            ledgerService.startSession(properties.getAgentName());
            ledgerService.startJob(jobId, properties.getAgentName());
            log.info("크롤링 작업 {} ({}) 을 시작합니다. 저장 위치: {}", jobId, job.getType().getValue(), outputDir.toAbsolutePath());

            prepareOutputDir(outputDir);
            CrawlResult previous = metadataRepository.load(metadataFile).orElse(null);
            ledgerService.checkMetadataSync(previous);

            Set<String> previousIds = previous == null ? Collections.emptySet() : previous.getProductIds();
            Set<String> skipIds = config.isSkipExisting() ? previousIds : Collections.emptySet();
            CrawlResult result = CrawlResult.seededFrom(previous, LocalDateTime.now());
            boolean interrupted = false;

            try (PageRenderer renderer = pageRendererFactory.open(config.isHeadless())) {
                List<String> targets = resolveTargets(job, renderer);
                log.info("처리 대상 상품: {}개", targets.size());

                for (int i = 0; i < targets.size(); i++) {
                    if (Thread.currentThread().isInterrupted()) {
                        interrupted = true;
                        break;
                    }
                    String url = targets.get(i);
                    log.info("상품 처리 {}/{}: {}", i + 1, targets.size(), url);
                    processProduct(job, renderer, url, skipIds, previousIds, result, counters, outputDir);
                    counters.sinceCheckpoint++;

                    if (counters.sinceCheckpoint >= properties.getCheckpointInterval()) {
                        metadataRepository.save(result, metadataFile);
                        counters.sinceCheckpoint = 0;
                        log.info("중간 저장 완료 ({}/{}번째 상품까지)", i + 1, targets.size());
                    }
                    waitWhilePaused(jobId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
            }

            metadataRepository.save(result, metadataFile);
            ledgerService.syncFromMetadata(result, config.getMetadataFile());

            if (!interrupted) {
                JobResult jobResult = counters.toResult(true, result, null);
                try {
                    completeWhenResumed(jobId, jobResult);
                    ledgerService.endSession(JobStatus.COMPLETED);
                    log.info("크롤링 작업 {} 완료 - 처리: {}, 건너뜀: {}, 신규 상품: {}, 신규 이미지: {}, 이미지 실패: {}",
                            jobId, counters.crawled, counters.skipped, counters.newProducts, counters.newImages, counters.failedDownloads);
                    return jobResult;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            log.warn("크롤링 작업 {} 이 중단되었습니다. (처리 {}개)", jobId, counters.crawled);
            JobResult jobResult = counters.toResult(false, result, INTERRUPTED_MESSAGE);
            ledgerService.completeJob(jobId, jobResult);
            ledgerService.endSession(JobStatus.FAILED);
            return jobResult;
        } catch (RuntimeException e) {
            log.error("크롤링 작업 {} 중 오류 발생: {}", jobId, e.getMessage());
            failJob(jobId, counters, e);
            throw e;
        } finally {
            running.set(false);
        }
    }

    private void failJob(String jobId, RunCounters counters, RuntimeException cause) {
        try {
            ledgerService.findJob(jobId)
                    .filter(job -> !job.getStatus().isTerminal())
                    .ifPresent(job -> ledgerService.completeJob(jobId, counters.toResult(false, null, cause.getMessage())));
            ledgerService.endSession(JobStatus.FAILED);
        } catch (RuntimeException ledgerError) {
            cause.addSuppressed(ledgerError);
        }
    }

    private static void prepareOutputDir(Path outputDir) {
        try {
            FileUtils.forceMkdir(outputDir.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("이미지 폴더를 만들 수 없습니다: " + outputDir, e);
        }
    }

    /**
     * 작업 종류별 처리 대상 URL 목록
     */
    private List<String> resolveTargets(CrawlJob job, PageRenderer renderer) throws InterruptedException {
        switch (job.getType()) {
            case RETRY_FAILED:
                return retryTargets();
            case SINGLE_PRODUCT:
                return List.of(job.getConfig().getTargetUrl());
            default:
                return discoverProductUrls(renderer, job.getConfig().getDelaySeconds());
        }
    }

    /**
     * 상품 목록 페이지를 차례로 열어 상품 URL 을 수집합니다.
     *
     * 종료 조건:
     * - 페이지에 상품 링크가 하나도 없을 때
     * - 페이지의 상품 링크가 모두 이미 수집한 것일 때
     * - 최대 페이지 수에 도달했을 때
     */
    List<String> discoverProductUrls(PageRenderer renderer, double delaySeconds) throws InterruptedException {
        List<String> productUrls = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String collectionUrl = stripTrailingSlash(properties.getBaseUrl()) + properties.getCollectionPath();

        for (int page = 1; page <= properties.getMaxPages(); page++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException();
            }
            String pageUrl = collectionUrl + "?page=" + page;
            log.info("목록 페이지 {} 탐색: {}", page, pageUrl);
            String html = renderer.render(pageUrl);
            politeDelay(delaySeconds);

            List<String> links = productPageParser.extractProductLinks(html, pageUrl);
            if (links.isEmpty()) {
                log.info("페이지 {} 에 상품이 없어 탐색을 종료합니다.", page);
                break;
            }
            List<String> fresh = new ArrayList<>();
            for (String link : links) {
                if (seen.add(link)) {
                    fresh.add(link);
                }
            }
            if (fresh.isEmpty()) {
                log.info("페이지 {} 에 새로운 상품이 없어 탐색을 종료합니다.", page);
                break;
            }
            productUrls.addAll(fresh);
            log.info("페이지 {} 에서 상품 {}개 발견 (누적 {}개)", page, fresh.size(), productUrls.size());
            ledgerService.updateSessionProgress(SessionProgressUpdate.builder()
                    .currentPage(page)
                    .productsDiscovered(productUrls.size())
                    .build());

            if (page == properties.getMaxPages()) {
                log.warn("최대 페이지 수({})에 도달하여 탐색을 종료합니다.", properties.getMaxPages());
            }
        }
        log.info("총 {}개의 상품 URL 을 수집했습니다.", productUrls.size());
        return productUrls;
    }

    /**
     * 재시도 대상: 미해결 오류가 있는 상품 URL + 이미지 다운로드가 실패한 상품 URL
     */
    private List<String> retryTargets() {
        Set<String> urls = new LinkedHashSet<>();
        for (ErrorEntry error : ledgerService.getUnresolvedErrors()) {
            if (error.getProductId() != null && error.getUrl() != null) {
                urls.add(error.getUrl());
            }
        }
        for (ProductEntry product : ledgerService.getFailedProducts()) {
            if (product.getUrl() != null) {
                urls.add(product.getUrl());
            }
        }
        ledgerService.updateSessionProgress(SessionProgressUpdate.builder()
                .productsDiscovered(urls.size())
                .build());
        return new ArrayList<>(urls);
    }

    /**
     * 상품 하나 처리. 실패해도 예외를 밖으로 던지지 않고 오류 로그만 남깁니다.
     * (스레드 인터럽트만 예외로 전달)
     */
    private void processProduct(CrawlJob job, PageRenderer renderer, String url, Set<String> skipIds,
                                Set<String> previousIds, CrawlResult result, RunCounters counters,
                                Path outputDir) throws InterruptedException {
        String jobId = job.getId();
        String productId = productPageParser.extractProductId(url);

        if (skipIds.contains(productId)) {
            counters.skipped++;
            log.info("이미 다운로드된 상품, 건너뜀: {}", productId);
            ledgerService.updateSessionProgress(SessionProgressUpdate.builder()
                    .productsSkipped(counters.skipped)
                    .lastProductUrl(url)
                    .build());
            return;
        }

        boolean succeeded = false;
        try {
            String html = renderer.render(url);
            politeDelay(job.getConfig().getDelaySeconds());

            ProductCandidate candidate = productPageParser.parse(html, url);
            if (isEmptyPage(candidate)) {
                ledgerService.logError(jobId, ErrorType.PARSE_FAILED, "상품 정보를 찾을 수 없습니다.", productId, url);
            } else {
                int existingFiles = countExistingFiles(candidate, outputDir);
                List<ProductImage> images = imageDownloadService.downloadProductImages(
                        candidate.getId(), candidate.getImageUrls(), outputDir);
                int failed = candidate.getImageUrls().size() - images.size();

                result.addProduct(Product.builder()
                        .id(candidate.getId())
                        .name(candidate.getName())
                        .url(url)
                        .price(candidate.getPrice())
                        .category(candidate.getCategory())
                        .images(images)
                        .crawledAt(LocalDateTime.now())
                        .build());

                ledgerService.addOrUpdateProduct(ProductUpdate.builder()
                        .productId(candidate.getId())
                        .name(candidate.getName())
                        .url(url)
                        .jobId(jobId)
                        .status(failed > 0 ? JobStatus.FAILED : JobStatus.COMPLETED)
                        .imageCount(candidate.getImageUrls().size())
                        .downloadedCount(images.size())
                        .failedCount(failed)
                        .price(candidate.getPrice())
                        .category(candidate.getCategory())
                        .build());

                counters.crawled++;
                counters.imagesDownloaded += images.size();
                counters.newImages += Math.max(0, images.size() - existingFiles);
                counters.failedDownloads += failed;
                if (!previousIds.contains(candidate.getId())) {
                    counters.newProducts++;
                }
                succeeded = failed == 0;
                log.info("[{}] {} - 이미지 {}/{}개", candidate.getId(), candidate.getName(), images.size(), candidate.getImageUrls().size());
            }
        } catch (PageRenderTimeoutException e) {
            log.error("상품 페이지 시간 초과: {} - {}", url, e.getMessage());
            ledgerService.logError(jobId, ErrorType.TIMEOUT, e.getMessage(), productId, url);
        } catch (RuntimeException e) {
            log.error("상품 처리 실패: {} - {}", url, e.getMessage());
            ledgerService.logError(jobId, ErrorType.CRAWL_FAILED, String.valueOf(e.getMessage()), productId, url);
        }

        if (job.getType() == JobType.RETRY_FAILED) {
            recordRetryOutcome(jobId, productId, succeeded);
        }
        ledgerService.updateSessionProgress(SessionProgressUpdate.builder()
                .productsCrawled(counters.crawled)
                .imagesDownloaded(counters.imagesDownloaded)
                .imagesFailed(counters.failedDownloads)
                .lastProductUrl(url)
                .build());
    }

    /**
     * 재시도 결과 반영: 성공하면 그 상품의 미해결 오류를 모두 해결 처리, 실패하면 이전 오류의 재시도 횟수 증가
     */
    private void recordRetryOutcome(String jobId, String productId, boolean succeeded) {
        if (succeeded) {
            int resolved = ledgerService.resolveErrorsForProduct(productId);
            if (resolved > 0) {
                log.info("[{}] 재시도 성공, 오류 {}건 해결", productId, resolved);
            }
            return;
        }
        for (ErrorEntry error : ledgerService.getUnresolvedErrors()) {
            if (productId.equals(error.getProductId()) && !jobId.equals(error.getJobId())) {
                ledgerService.incrementRetryCount(error.getId());
            }
        }
    }

    /** 이름도 가격도 이미지도 찾지 못한 페이지 */
    private static boolean isEmptyPage(ProductCandidate candidate) {
        return candidate.getImageUrls().isEmpty()
                && candidate.getPrice() == null
                && ProductPageParser.UNKNOWN_NAME.equals(candidate.getName());
    }

    private static int countExistingFiles(ProductCandidate candidate, Path outputDir) {
        int count = 0;
        List<String> imageUrls = candidate.getImageUrls();
        for (int i = 0; i < imageUrls.size(); i++) {
            if (Files.exists(outputDir.resolve(ImageDownloadService.imageFilename(candidate.getId(), i + 1, imageUrls.get(i))))) {
                count++;
            }
        }
        return count;
    }

    /**
     * 마지막 상품 이후(또는 대상이 없을 때) 들어온 일시 정지가 풀린 뒤에 작업을 완료 처리합니다.
     * 정지 여부 확인과 완료 처리 사이에 정지 요청이 끼어들지 않도록 장부 잠금 안에서 완료합니다.
     */
    private void completeWhenResumed(String jobId, JobResult jobResult) throws InterruptedException {
        while (true) {
            waitWhilePaused(jobId);
            synchronized (ledgerService) {
                if (!ledgerService.isPaused(jobId)) {
                    ledgerService.completeJob(jobId, jobResult);
                    return;
                }
            }
        }
    }

    /**
     * 일시 정지된 작업이면 재개될 때까지 기다립니다.
     */
    private void waitWhilePaused(String jobId) throws InterruptedException {
        if (!ledgerService.isPaused(jobId)) {
            return;
        }
        log.info("작업 {} 이 일시 정지되었습니다. 재개를 기다립니다.", jobId);
        while (ledgerService.isPaused(jobId)) {
            TimeUnit.SECONDS.sleep(1);
        }
        log.info("작업 {} 을 재개합니다.", jobId);
    }

    /** 요청 사이 고정 대기 */
    private static void politeDelay(double delaySeconds) throws InterruptedException {
        long millis = Math.round(delaySeconds * 1000);
        if (millis > 0) {
            TimeUnit.MILLISECONDS.sleep(millis);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /** 한 번의 실행 동안의 집계 */
    private static final class RunCounters {
        private int crawled;
        private int skipped;
        private int newProducts;
        private int newImages;
        private int imagesDownloaded;
        private int failedDownloads;
        private int sinceCheckpoint;

        private JobResult toResult(boolean success, CrawlResult result, String errorMessage) {
            return JobResult.builder()
                    .success(success)
                    .totalProducts(result == null ? crawled : result.getTotalProducts())
                    .totalImages(result == null ? imagesDownloaded : result.getTotalImages())
                    .newProducts(newProducts)
                    .newImages(newImages)
                    .skippedProducts(skipped)
                    .failedDownloads(failedDownloads)
                    .errorMessage(errorMessage)
                    .build();
        }
    }
}
