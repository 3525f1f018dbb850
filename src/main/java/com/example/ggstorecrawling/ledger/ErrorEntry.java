package com.example.ggstorecrawling.ledger;

import com.example.ggstorecrawling.entity.ErrorType;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * 오류 로그 항목
 *
 * 한 번 기록되면 삭제되지 않습니다. 해결 여부(resolved)만 따로 바뀝니다.
 */
@Getter
@Setter
@NoArgsConstructor
public class ErrorEntry {

    /** 오류 ID (ERR-001 형식) */
    private String id;
    private LocalDateTime timestamp;
    private String jobId;
    private String productId;
    private ErrorType type;
    private String url;
    private String message;
    private int retryCount;
    private boolean resolved;

    @Builder
    public ErrorEntry(String id, LocalDateTime timestamp, String jobId, String productId,
                      ErrorType type, String url, String message) {
        this.id = id;
        this.timestamp = timestamp;
        this.jobId = jobId;
        this.productId = productId;
        this.type = type;
        this.url = url;
        this.message = message;
    }
}
