package net.kairos.core.service;

import net.kairos.core.job.CronContext;
import net.kairos.core.job.CronHandler;
import net.kairos.core.model.Execution;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.EventLog;
import net.kairos.core.spi.SqlOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * recordStart 이후의 공통 실행 단계: 핸들러 호출 → 결과 기록.
 * tick, catch-up, 수동 실행이 모두 이 경로를 탄다. 핸들러 예외는 절대 밖으로 던지지 않는다.
 */
public final class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final ExecutionLedger ledger;
    private final SqlOperations db;
    private final EventLog eventLog;
    private final Clock clock;

    public JobExecutor(ExecutionLedger ledger, SqlOperations db, EventLog eventLog, Clock clock) {
        this.ledger = ledger;
        this.db = db;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    public Execution execute(String jobName,
                             CronHandler<?> handler,
                             String executionId,
                             Instant scheduledTime,
                             Instant actualTime) {
        CronContext ctx = new CronContext(jobName, scheduledTime, actualTime, executionId, db, eventLog);

        Execution.Status status = Execution.Status.COMPLETED;
        Object output = null;
        String error = null;

        log.debug("Executing job '{}' (scheduled {}, execution {})", jobName, scheduledTime, executionId);
        long started = System.nanoTime();
        try {
            output = handler.handle(ctx);
        } catch (Throwable t) {
            // Error 포함
            status = Execution.Status.FAILED;
            error = describe(t);
            log.warn("Job '{}' failed (execution {}): {}", jobName, executionId, error, t);
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        String outputJson = null;
        if (status == Execution.Status.COMPLETED) {
            try {
                outputJson = ledger.serialize(output);
            } catch (Exception e) {
                status = Execution.Status.FAILED;
                error = "output is not serializable: " + describe(e);
                output = null;
                log.warn("Job '{}' returned an unserializable output (execution {})", jobName, executionId, e);
            }
        }

        try {
            ledger.recordOutcome(executionId, status, outputJson, error, durationMs);
        } catch (Exception e) {
            // 행은 RUNNING으로 남고 maintenance가 나중에 마감한다
            log.error("Failed to record outcome of execution {} for job '{}'", executionId, jobName, e);
        }

        if (status == Execution.Status.COMPLETED) {
            log.info("Job '{}' completed in {} ms (scheduled {})", jobName, durationMs, scheduledTime);
        }
        return new Execution(executionId, jobName, scheduledTime, actualTime, status,
                output, error, durationMs, clock.now());
    }

    static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getName() : msg;
    }
}
