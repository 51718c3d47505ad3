package net.kairos.core.spi;

import net.kairos.core.model.Execution;
import net.kairos.core.model.HistoryQuery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ExecutionRepository {
    /**
     * RUNNING 행 삽입. (JOB_NAME, SCHEDULED_TIME) 이미 있으면 아무것도 하지 않고 false.
     */
    boolean insertRunning(String executionId, String jobName, Instant scheduledTime, Instant actualTime) throws Exception;

    /** RUNNING → COMPLETED/FAILED 단 한 번. 반영된 행이 없으면 false */
    boolean complete(String executionId, Execution.Status status, String outputJson, String error, long durationMs) throws Exception;

    boolean exists(String jobName, Instant scheduledTime) throws Exception;

    Optional<Execution> findById(String executionId) throws Exception;

    /** SCHEDULED_TIME 내림차순 */
    List<Execution> history(String jobName, HistoryQuery query) throws Exception;

    /** 시작 후 threshold 이전인데 여전히 RUNNING 인 행을 FAILED로 마감 (maintenance) */
    int failAbandoned(Instant startedBefore, String reason) throws Exception;
}
