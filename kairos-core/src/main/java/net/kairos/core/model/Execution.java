package net.kairos.core.model;

import java.time.Instant;

public record Execution(
        String executionId,
        String jobName,
        Instant scheduledTime,   // 논리 tick 시각 (JOB_NAME과 함께 유니크)
        Instant actualTime,      // 실제 시작 wall-clock
        Status status,
        Object output,
        String error,
        Long durationMs,
        Instant completedAt
) {
    public enum Status {
        PENDING, RUNNING, COMPLETED, FAILED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() { return this == COMPLETED || this == FAILED; }
    }

    public boolean succeeded() {
        return status == Status.COMPLETED;
    }
}
