package com.example.ggstorecrawling.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 장부 상태 요약 (status 명령 / GET /status 응답)
 */
@Value
@Builder
public class LedgerSummary {
    String project;
    String targetSite;
    LocalDateTime updatedAt;
    /** 세션이 한 번도 시작되지 않았으면 null */
    CrawlSession currentSession;
    LedgerStats stats;
    int errorsCount;
    int unresolvedErrors;
    MetadataSync metadataSync;
}
