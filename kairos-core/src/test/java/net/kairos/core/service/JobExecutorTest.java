package net.kairos.core.service;

import net.kairos.core.model.Execution;
import net.kairos.core.support.InMemoryCronStore;
import net.kairos.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobExecutorTest {

    static final Instant T = Instant.parse("2024-01-01T09:00:00Z");

    MutableClock clock;
    InMemoryCronStore store;
    ExecutionLedger ledger;
    List<String> emitted;
    JobExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(T);
        store = new InMemoryCronStore(clock);
        ledger = new ExecutionLedger(store.executions(), store.tx(), store.codec());
        emitted = new ArrayList<>();
        executor = new JobExecutor(ledger, store.sql(), (logName, data) -> {
            if (logName.equals("broken")) throw new IllegalStateException("log unavailable");
            emitted.add(logName + ":" + data);
        }, clock);
        store.jobs().upsert("job", "* * * * *", "UTC", false, 10, T);
        ledger.recordStart("job_1", "job", T, T);
    }

    @Test
    void success_recordsOutputAndContext() throws Exception {
        Execution e = executor.execute("job", ctx -> {
            ctx.db().update("DELETE FROM SESSIONS WHERE EXPIRED");
            ctx.emit("audit", ctx.executionId());
            return Map.of("job", ctx.jobName(), "at", ctx.scheduledTime().toString());
        }, "job_1", T, T);

        assertThat(e.status()).isEqualTo(Execution.Status.COMPLETED);
        assertThat(emitted).containsExactly("audit:job_1");
        assertThat(store.executedSql()).containsExactly("DELETE FROM SESSIONS WHERE EXPIRED");
        assertThat(ledger.find("job_1").orElseThrow().output())
                .isEqualTo(Map.of("job", "job", "at", "2024-01-01T09:00:00Z"));
    }

    @Test
    void handlerException_becomesFailedExecution() throws Exception {
        Execution e = executor.execute("job", ctx -> {
            throw new IllegalArgumentException("bad input");
        }, "job_1", T, T);

        assertThat(e.status()).isEqualTo(Execution.Status.FAILED);
        assertThat(e.error()).isEqualTo("bad input");
        assertThat(ledger.find("job_1").orElseThrow().error()).isEqualTo("bad input");
    }

    @Test
    void handlerError_isAlsoRecordedAsFailure() throws Exception {
        Execution e = executor.execute("job", ctx -> {
            throw new NoClassDefFoundError("com/acme/ReportClient");
        }, "job_1", T, T);

        assertThat(e.status()).isEqualTo(Execution.Status.FAILED);
        assertThat(e.error()).isEqualTo("com/acme/ReportClient");
        Execution stored = ledger.find("job_1").orElseThrow();
        assertThat(stored.status()).isEqualTo(Execution.Status.FAILED);
        assertThat(stored.error()).isEqualTo("com/acme/ReportClient");
    }

    @Test
    void exceptionWithoutMessage_usesClassName() {
        assertThat(JobExecutor.describe(new NullPointerException())).isEqualTo("java.lang.NullPointerException");
    }

    @Test
    void emitFailure_doesNotFailTheRun() throws Exception {
        Execution e = executor.execute("job", ctx -> ctx.emit("broken", "x"), "job_1", T, T);

        assertThat(e.status()).isEqualTo(Execution.Status.COMPLETED);
        assertThat(e.output()).isEqualTo(false);
    }

    @Test
    void unserializableOutput_isRecordedAsFailure() throws Exception {
        Execution e = executor.execute("job", ctx -> new Object(), "job_1", T, T);

        assertThat(e.status()).isEqualTo(Execution.Status.FAILED);
        assertThat(e.error()).startsWith("output is not serializable");
    }
}
