package com.example.ggstorecrawling.ledger;

import com.example.ggstorecrawling.entity.JobStatus;
import com.example.ggstorecrawling.entity.JobType;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 크롤링 작업 정의와 상태
 */
@Getter
@Setter
@NoArgsConstructor
public class CrawlJob {

    /** 작업 ID (JOB-001 형식, 순차 증가) */
    private String id;
    private JobType type;
    private JobStatus status = JobStatus.PENDING;
    /** 우선순위: high, medium, low */
    private String priority = "medium";
    private JobExecution execution = new JobExecution();
    private JobConfig config = new JobConfig();
    /** 완료 전에는 null */
    private JobResult result;

    @Builder
    public CrawlJob(String id, JobType type, String priority, JobConfig config) {
        this.id = id;
        this.type = type;
        this.status = JobStatus.PENDING;
        this.priority = priority == null ? "medium" : priority;
        this.execution = new JobExecution();
        this.config = config == null ? new JobConfig() : config;
    }
}
