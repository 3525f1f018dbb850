package com.example.ggstorecrawling.runner;

import com.example.ggstorecrawling.entity.JobType;
import com.example.ggstorecrawling.ledger.ErrorEntry;
import com.example.ggstorecrawling.ledger.JobResult;
import com.example.ggstorecrawling.service.CrawlLedgerService;
import com.example.ggstorecrawling.service.CrawlRequest;
import com.example.ggstorecrawling.service.CrawlingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

/**
 * 명령줄 실행기
 *
 * 사용법:
 *   crawl  [--output=DIR] [--metadata=FILE] [--checklist=FILE] [--delay=SEC]
 *          [--no-headless] [--no-skip] [--type=full_crawl|incremental|retry_failed] [--url=URL] [-v]
 *   status [--checklist=FILE]
 *   errors [--checklist=FILE] [--limit=N | -n N]
 *
 * 첫 번째 인자가 명령이 아니면 (서버 모드) 아무것도 하지 않습니다.
 * 종료 코드: 성공 0, 실패 1
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrawlCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final Set<String> COMMANDS = Set.of("crawl", "status", "errors");

    private static final String BASE_PACKAGE = "com.example.ggstorecrawling";
    private static final int DEFAULT_ERROR_LIMIT = 10;

    private final CrawlingService crawlingService;
    private final CrawlLedgerService ledgerService;
    private final LoggingSystem loggingSystem;

    private PrintStream out = System.out;
    private int exitCode = 0;

    public static boolean isCommand(String[] args) {
        return args.length > 0 && COMMANDS.contains(args[0]);
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty() || !COMMANDS.contains(positional.get(0))) {
            return;
        }
        if (positional.contains("-v") || args.containsOption("verbose")) {
            loggingSystem.setLogLevel(BASE_PACKAGE, LogLevel.DEBUG);
        }

        try {
            String checklist = option(args, "checklist");
            if (checklist != null) {
                ledgerService.open(Paths.get(checklist));
            }
            switch (positional.get(0)) {
                case "status":
                    out.println(ledgerService.formatStatus());
                    exitCode = 0;
                    break;
                case "errors":
                    exitCode = showErrors(errorLimit(args, positional));
                    break;
                default:
                    exitCode = crawl(args);
                    break;
            }
        } catch (RuntimeException e) {
            log.error("명령 실행 실패: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    private int crawl(ApplicationArguments args) {
        String url = option(args, "url");
        String type = option(args, "type");
        JobType jobType;
        if (type != null) {
            jobType = JobType.fromValue(type);
        } else {
            jobType = url != null ? JobType.SINGLE_PRODUCT : JobType.FULL_CRAWL;
        }
        String delay = option(args, "delay");

        CrawlRequest request = CrawlRequest.builder()
                .type(jobType)
                .targetUrl(url)
                .outputDir(option(args, "output"))
                .metadataFile(option(args, "metadata"))
                .delaySeconds(delay == null ? null : Double.valueOf(delay))
                .headless(args.containsOption("no-headless") ? Boolean.FALSE : null)
                .skipExisting(args.containsOption("no-skip") ? Boolean.FALSE : null)
                .build();

        JobResult result = crawlingService.run(request);
        out.println("=== 크롤링 결과 ===");
        out.println("성공: " + result.isSuccess());
        out.println("상품: " + result.getTotalProducts() + " (신규 " + result.getNewProducts()
                + ", 건너뜀 " + result.getSkippedProducts() + ")");
        out.println("이미지: " + result.getTotalImages() + " (신규 " + result.getNewImages()
                + ", 실패 " + result.getFailedDownloads() + ")");
        if (result.getErrorMessage() != null) {
            out.println("오류: " + result.getErrorMessage());
        }
        return result.isSuccess() ? 0 : 1;
    }

    private int showErrors(int limit) {
        List<ErrorEntry> errors = ledgerService.getUnresolvedErrors();
        if (errors.isEmpty()) {
            out.println("미해결 오류가 없습니다.");
            return 0;
        }
        out.println("=== 미해결 오류 (총 " + errors.size() + "건) ===");
        out.println();
        for (ErrorEntry error : errors.subList(0, Math.min(limit, errors.size()))) {
            out.println("[" + error.getId() + "] " + error.getType().getValue());
            out.println("  작업: " + error.getJobId());
            if (error.getProductId() != null) {
                out.println("  상품: " + error.getProductId());
            }
            if (error.getUrl() != null) {
                out.println("  URL: " + error.getUrl());
            }
            out.println("  메시지: " + error.getMessage());
            out.println("  시각: " + error.getTimestamp() + " (재시도 " + error.getRetryCount() + "회)");
            out.println();
        }
        if (errors.size() > limit) {
            out.println("... 외 " + (errors.size() - limit) + "건");
        }
        return 0;
    }

    private static int errorLimit(ApplicationArguments args, List<String> positional) {
        String limit = option(args, "limit");
        int shortFlag = positional.indexOf("-n");
        if (limit == null && shortFlag >= 0 && shortFlag + 1 < positional.size()) {
            limit = positional.get(shortFlag + 1);
        }
        if (limit == null) {
            return DEFAULT_ERROR_LIMIT;
        }
        int value = Integer.parseInt(limit);
        if (value <= 0) {
            throw new IllegalArgumentException("limit 는 1 이상이어야 합니다: " + value);
        }
        return value;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}
