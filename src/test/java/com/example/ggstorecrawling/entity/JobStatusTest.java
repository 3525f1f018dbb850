package com.example.ggstorecrawling.entity;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobStatus 테스트")
class JobStatusTest {

    @Test
    @DisplayName("허용된 상태 전이")
    void allowedTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.IN_PROGRESS));
        assertTrue(JobStatus.IN_PROGRESS.canTransitionTo(JobStatus.PAUSED));
        assertTrue(JobStatus.PAUSED.canTransitionTo(JobStatus.IN_PROGRESS));
        assertTrue(JobStatus.IN_PROGRESS.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.PAUSED.canTransitionTo(JobStatus.FAILED));
    }

    @Test
    @DisplayName("종료 상태에서는 어떤 상태로도 바뀌지 않는다")
    void terminalStates() {
        for (JobStatus next : JobStatus.values()) {
            assertFalse(JobStatus.COMPLETED.canTransitionTo(next));
            assertFalse(JobStatus.FAILED.canTransitionTo(next));
        }
        assertTrue(JobStatus.COMPLETED.isTerminal());
        assertFalse(JobStatus.PAUSED.isTerminal());
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED));
    }

    @Test
    @DisplayName("JSON 에는 소문자 값으로 기록되고, 이름으로도 읽을 수 있다")
    void jsonValues() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"in_progress\"", mapper.writeValueAsString(JobStatus.IN_PROGRESS));
        assertEquals(JobStatus.PAUSED, mapper.readValue("\"paused\"", JobStatus.class));
        assertEquals(JobStatus.FAILED, JobStatus.fromValue("FAILED"));
        assertThrows(IllegalArgumentException.class, () -> JobStatus.fromValue("running"));
    }
}
