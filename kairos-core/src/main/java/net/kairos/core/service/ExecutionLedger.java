package net.kairos.core.service;

import net.kairos.core.model.Execution;
import net.kairos.core.model.HistoryQuery;
import net.kairos.core.spi.ExecutionRepository;
import net.kairos.core.spi.OutputCodec;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** (job, scheduled instant) 당 한 행: 멱등 가드이자 감사 이력 */
public final class ExecutionLedger {
    private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);

    private final ExecutionRepository executions;
    private final TxRunner tx;
    private final OutputCodec codec;

    public ExecutionLedger(ExecutionRepository executions, TxRunner tx, OutputCodec codec) {
        this.executions = executions;
        this.tx = tx;
        this.codec = codec;
    }

    /** false = 이미 기록된 슬롯 (다른 인스턴스가 선점). 호출 측은 시도를 포기해야 한다 */
    public boolean recordStart(String executionId, String jobName, Instant scheduledTime, Instant actualTime) throws Exception {
        boolean inserted = tx.requiresNew(() -> executions.insertRunning(executionId, jobName, scheduledTime, actualTime));
        if (!inserted) {
            log.debug("Execution for job '{}' at {} already recorded", jobName, scheduledTime);
        }
        return inserted;
    }

    public void recordOutcome(String executionId, Execution.Status status, String outputJson, String error, long durationMs) throws Exception {
        if (!status.terminal()) {
            throw new IllegalArgumentException("outcome must be COMPLETED or FAILED, got " + status);
        }
        boolean updated = tx.requiresNew(() -> executions.complete(executionId, status, outputJson, error, durationMs));
        if (!updated) {
            // lease 경합에서 진 쪽: 행이 없거나 이미 마감됨
            log.debug("Outcome for execution {} not recorded (row missing or already final)", executionId);
        }
    }

    public String serialize(Object output) throws Exception {
        return output == null ? null : codec.encode(output);
    }

    public boolean exists(String jobName, Instant scheduledTime) throws Exception {
        return tx.required(() -> executions.exists(jobName, scheduledTime));
    }

    public Optional<Execution> find(String executionId) throws Exception {
        return tx.required(() -> executions.findById(executionId));
    }

    public List<Execution> history(String jobName, HistoryQuery query) throws Exception {
        return tx.required(() -> executions.history(jobName, query == null ? HistoryQuery.all() : query));
    }
}
