package com.example.ggstorecrawling.ledger;

import com.example.ggstorecrawling.entity.JobStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 진행 중인 크롤링 세션
 *
 * Job 의 실행 기록보다 자주 갱신되는 실시간 진행 현황입니다.
 */
@Getter
@Setter
@NoArgsConstructor
public class CrawlSession {

    /** 세션 ID (SESSION-XXXXXXXX) */
    private String id;
    private LocalDateTime startedAt;
    private JobStatus status = JobStatus.PENDING;
    private String agent;
    private SessionProgress progress = new SessionProgress();

    @Builder
    public CrawlSession(String id, LocalDateTime startedAt, JobStatus status, String agent) {
        this.id = id;
        this.startedAt = startedAt;
        this.status = status;
        this.agent = agent;
        this.progress = new SessionProgress();
    }
}
