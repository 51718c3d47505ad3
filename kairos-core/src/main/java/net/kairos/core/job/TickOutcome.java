package net.kairos.core.job;

/** tick 한 번의 결과 (테스트/로그용) */
public enum TickOutcome {
    STOPPED,
    LEASE_NOT_ACQUIRED,
    NOT_DUE,
    ALREADY_RECORDED,
    EXECUTED,
    ABORTED
}
