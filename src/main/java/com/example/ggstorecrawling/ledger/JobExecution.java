package com.example.ggstorecrawling.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 작업 실행 기록
 */
@Getter
@Setter
@NoArgsConstructor
public class JobExecution {
    private String agent;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long durationSeconds;
}
