package net.kairos.core.job;

import net.kairos.core.cron.InvalidCronExpressionException;
import net.kairos.core.model.Execution;
import net.kairos.core.model.HistoryQuery;
import net.kairos.core.model.Job;
import net.kairos.core.spi.WorkflowLauncher;
import net.kairos.core.support.InMemoryCronStore;
import net.kairos.core.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class CronJobTest {

    static final Instant START = Instant.parse("2024-01-01T09:30:00Z");
    static final Instant TEN = Instant.parse("2024-01-01T10:00:00Z");
    /** 백그라운드 tick이 테스트 중에 끼어들지 않도록 */
    static final SchedulerSettings MANUAL_TICKS = SchedulerSettings.defaults().withTickInterval(Duration.ofHours(1));

    MutableClock clock;
    InMemoryCronStore store;
    AtomicInteger calls;
    List<CronJob> started;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryCronStore(clock);
        calls = new AtomicInteger();
        started = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        started.forEach(CronJob::stop);
    }

    private CronJob.Builder hourly(String instance) {
        return CronJob.builder("hourly")
                .schedule("0 * * * *")
                .store(store)
                .clock(clock)
                .settings(MANUAL_TICKS)
                .instanceId(instance)
                .handler(ctx -> calls.incrementAndGet());
    }

    private CronJob startJob(CronJob job) throws Exception {
        job.start();
        started.add(job);
        return job;
    }

    @Test
    void start_registersJob_withNextSlotAfterNow() throws Exception {
        CronJob job = hourly("a").build();
        assertThat(job.nextRun()).isEmpty();

        startJob(job);

        assertThat(job.isRunning()).isTrue();
        assertThat(job.nextRun()).contains(TEN);
        Job row = store.job("hourly").orElseThrow();
        assertThat(row.nextScheduledTime()).isEqualTo(TEN);
        assertThat(row.lastScheduledTime()).isNull();
        assertThat(row.schedule()).isEqualTo("0 * * * *");
    }

    @Test
    void tick_beforeDue_doesNothing() throws Exception {
        CronJob job = startJob(hourly("a").build());

        assertThat(job.tickOnce()).isEqualTo(TickOutcome.NOT_DUE);
        assertThat(calls.get()).isZero();
        assertThat(store.leases().findByJob("hourly")).isEmpty();
    }

    @Test
    void tick_whenDue_executesOnce_andAdvancesCursor() throws Exception {
        CronJob job = startJob(hourly("a").build());
        clock.set(TEN.plusSeconds(1));

        assertThat(job.tickOnce()).isEqualTo(TickOutcome.EXECUTED);
        assertThat(job.tickOnce()).isEqualTo(TickOutcome.NOT_DUE);

        assertThat(calls.get()).isEqualTo(1);
        Execution e = job.history().get(0);
        assertThat(e.executionId()).isEqualTo("hourly_" + TEN.toEpochMilli());
        assertThat(e.scheduledTime()).isEqualTo(TEN);
        assertThat(e.actualTime()).isEqualTo(TEN.plusSeconds(1));
        assertThat(e.status()).isEqualTo(Execution.Status.COMPLETED);
        assertThat(e.output()).isEqualTo(1);

        Job row = job.state().orElseThrow();
        assertThat(row.lastScheduledTime()).isEqualTo(TEN);
        assertThat(row.nextScheduledTime()).isEqualTo(Instant.parse("2024-01-01T11:00:00Z"));
        // lease는 tick 끝에 반납됨
        assertThat(store.leases().findByJob("hourly")).isEmpty();
    }

    @Test
    void concurrentRunners_executeEachSlotExactlyOnce() throws Exception {
        CronJob a = startJob(hourly("a").build());
        CronJob b = startJob(hourly("b").build());
        clock.set(TEN.plusSeconds(5));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<TickOutcome>> results = new ArrayList<>();
            for (CronJob runner : List.of(a, b)) {
                Callable<TickOutcome> tick = () -> {
                    go.await();
                    return runner.tickOnce();
                };
                results.add(pool.submit(tick));
            }
            go.countDown();
            List<TickOutcome> outcomes = new ArrayList<>();
            for (Future<TickOutcome> f : results) outcomes.add(f.get());

            assertThat(outcomes).containsOnlyOnce(TickOutcome.EXECUTED);
        } finally {
            pool.shutdownNow();
        }
        assertThat(calls.get()).isEqualTo(1);
        assertThat(store.allExecutions()).hasSize(1);
    }

    @Test
    void alreadyRecordedSlot_isSkipped_butCursorStillAdvances() throws Exception {
        CronJob job = startJob(hourly("a").build());
        store.executions().insertRunning("hourly_other", "hourly", TEN, TEN);
        clock.set(TEN.plusSeconds(1));

        assertThat(job.tickOnce()).isEqualTo(TickOutcome.ALREADY_RECORDED);

        assertThat(calls.get()).isZero();
        assertThat(job.state().orElseThrow().nextScheduledTime()).isEqualTo(Instant.parse("2024-01-01T11:00:00Z"));
    }

    @Test
    void leaseHeldByOtherInstance_blocksTick() throws Exception {
        CronJob job = startJob(hourly("a").build());
        clock.set(TEN.plusSeconds(1));
        store.leases().tryAcquire("hourly", "someone-else", Duration.ofSeconds(30));

        assertThat(job.tickOnce()).isEqualTo(TickOutcome.LEASE_NOT_ACQUIRED);
        assertThat(calls.get()).isZero();

        // 만료 후에는 획득 가능
        clock.advance(Duration.ofSeconds(31));
        assertThat(job.tickOnce()).isEqualTo(TickOutcome.EXECUTED);
    }

    @Test
    void disabledJob_isNotDue() throws Exception {
        CronJob job = startJob(hourly("a").build());
        store.jobs().setEnabled("hourly", false);
        clock.set(TEN.plusSeconds(1));

        assertThat(job.tickOnce()).isEqualTo(TickOutcome.NOT_DUE);
    }

    @Test
    void failingHandler_isRecorded_andCursorMovesOn() throws Exception {
        CronJob job = startJob(hourly("a").handler(ctx -> {
            throw new IllegalStateException("report service down");
        }).build());
        clock.set(TEN.plusSeconds(1));

        assertThat(job.tickOnce()).isEqualTo(TickOutcome.EXECUTED);

        Execution e = job.history(HistoryQuery.latest(1)).get(0);
        assertThat(e.status()).isEqualTo(Execution.Status.FAILED);
        assertThat(e.error()).isEqualTo("report service down");
        assertThat(job.state().orElseThrow().nextScheduledTime()).isEqualTo(Instant.parse("2024-01-01T11:00:00Z"));
    }

    @Test
    void stop_haltsFurtherTicks() throws Exception {
        CronJob job = startJob(hourly("a").build());
        job.stop();
        clock.set(TEN.plusSeconds(1));

        assertThat(job.isRunning()).isFalse();
        assertThat(job.nextRun()).isEmpty();
        assertThat(job.tickOnce()).isEqualTo(TickOutcome.STOPPED);
        assertThat(calls.get()).isZero();
        // 두 번 멈춰도 문제 없음
        job.stop();
    }

    @Test
    void backgroundLoop_picksUpDueSlot() throws Exception {
        CronJob job = startJob(hourly("a")
                .settings(SchedulerSettings.defaults().withTickInterval(Duration.ofMillis(20)))
                .build());
        clock.set(TEN.plusSeconds(1));

        await().atMost(Duration.ofSeconds(5)).until(() -> calls.get() == 1);
        assertThat(job.history()).hasSize(1);
    }

    @Test
    void start_runsCatchUp_forSlotsMissedWhileDown() throws Exception {
        store.putJob(new Job("hourly", "0 * * * *", "UTC", true, 10, true,
                Instant.parse("2024-01-01T07:00:00Z"), Instant.parse("2024-01-01T08:00:00Z"), START, START));

        CronJob job = startJob(hourly("a").catchUp(true).build());

        await().atMost(Duration.ofSeconds(5)).until(() -> calls.get() == 2);
        assertThat(job.history()).extracting(Execution::scheduledTime).containsExactly(
                Instant.parse("2024-01-01T09:00:00Z"),
                Instant.parse("2024-01-01T08:00:00Z"));
    }

    @Test
    void firstTick_waitsUntilStartupCatchUpFinishes() throws Exception {
        store.putJob(new Job("hourly", "0 * * * *", "UTC", true, 10, true,
                Instant.parse("2024-01-01T07:00:00Z"), Instant.parse("2024-01-01T08:00:00Z"), START, START));
        String tickId = "hourly_" + TEN.toEpochMilli();
        List<String> ran = new CopyOnWriteArrayList<>();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch catchUpEntered = new CountDownLatch(1);
        CountDownLatch releaseCatchUp = new CountDownLatch(1);

        startJob(hourly("a")
                .catchUp(true)
                .settings(SchedulerSettings.defaults().withTickInterval(Duration.ofMillis(20)))
                .handler(ctx -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    try {
                        ran.add(ctx.executionId());
                        if (ctx.executionId().contains("_catchup_")) {
                            catchUpEntered.countDown();
                            releaseCatchUp.await(5, TimeUnit.SECONDS);
                        }
                        return null;
                    } finally {
                        inFlight.decrementAndGet();
                    }
                })
                .build());

        assertThat(catchUpEntered.await(5, TimeUnit.SECONDS)).isTrue();
        clock.set(TEN.plusSeconds(1));

        // catch-up이 붙잡혀 있는 동안 10:00 슬롯은 tick 되지 않아야 함
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2))
                .until(() -> !ran.contains(tickId));

        releaseCatchUp.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> ran.contains(tickId));

        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(ran).containsExactly(
                "hourly_catchup_" + Instant.parse("2024-01-01T08:00:00Z").toEpochMilli(),
                "hourly_catchup_" + Instant.parse("2024-01-01T09:00:00Z").toEpochMilli(),
                tickId);
    }

    @Test
    void handlerError_isRecordedAsFailed_andLoopKeepsTicking() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CronJob job = startJob(hourly("a")
                .settings(SchedulerSettings.defaults().withTickInterval(Duration.ofMillis(20)))
                .handler(ctx -> {
                    if (attempts.incrementAndGet() == 1) throw new AssertionError("bug");
                    return "ok";
                })
                .build());

        clock.set(TEN.plusSeconds(1));
        await().atMost(Duration.ofSeconds(5)).until(() -> job.history().stream()
                .anyMatch(e -> e.scheduledTime().equals(TEN) && e.status() == Execution.Status.FAILED));

        clock.set(Instant.parse("2024-01-01T11:00:01Z"));
        await().atMost(Duration.ofSeconds(5)).until(() -> job.history().stream()
                .anyMatch(e -> e.status() == Execution.Status.COMPLETED));

        assertThat(job.isRunning()).isTrue();
        assertThat(attempts.get()).isEqualTo(2);
        List<Execution> history = job.history();
        assertThat(history).extracting(Execution::status)
                .containsExactly(Execution.Status.COMPLETED, Execution.Status.FAILED);
        assertThat(history.get(1).error()).isEqualTo("bug");
    }

    @Test
    void trigger_returnsFailedExecution_whenHandlerThrowsError() throws Exception {
        CronJob job = hourly("a").handler(ctx -> {
            throw new AssertionError("bug");
        }).build();

        Execution e = job.trigger();

        assertThat(e.status()).isEqualTo(Execution.Status.FAILED);
        assertThat(e.error()).isEqualTo("bug");
        assertThat(job.history()).extracting(Execution::status).containsExactly(Execution.Status.FAILED);
    }

    @Test
    void trigger_runsImmediately_andNeverThrowsForHandlerFailure() throws Exception {
        CronJob job = hourly("a").handler(ctx -> {
            throw new IllegalStateException("nope");
        }).build();

        Execution e = job.trigger();

        assertThat(e.status()).isEqualTo(Execution.Status.FAILED);
        assertThat(e.error()).isNotBlank();
        assertThat(e.executionId()).startsWith("hourly_manual_");
        assertThat(e.scheduledTime()).isEqualTo(START);
        assertThat(store.job("hourly")).isPresent();
        assertThat(job.history()).hasSize(1);
    }

    @Test
    void trigger_doesNotResetCursor() throws Exception {
        CronJob job = startJob(hourly("a").build());
        clock.set(TEN.plusSeconds(1));
        job.tickOnce();

        job.trigger();

        assertThat(job.state().orElseThrow().nextScheduledTime()).isEqualTo(Instant.parse("2024-01-01T11:00:00Z"));
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void workflow_isStartedWithExecutionDerivedId() throws Exception {
        List<String> workflowIds = new CopyOnWriteArrayList<>();
        WorkflowLauncher<Map<String, Object>, String> launcher = (workflowId, input) -> {
            workflowIds.add(workflowId);
            return new WorkflowLauncher.WorkflowHandle<>() {
                @Override public String workflowId() { return workflowId; }
                @Override public String result() { return "done:" + input.get("executionId"); }
            };
        };
        CronJob job = CronJob.builder("wf")
                .schedule("*/5 * * * *")
                .store(store)
                .clock(clock)
                .handler(CronHandler.workflow(launcher))
                .build();

        Execution e = job.trigger();

        assertThat(e.status()).isEqualTo(Execution.Status.COMPLETED);
        assertThat(workflowIds).containsExactly("cron_" + e.executionId());
        assertThat(e.output()).isEqualTo("done:" + e.executionId());
    }

    @Test
    void build_failsFast_onMissingOrInvalidConfiguration() {
        assertThatThrownBy(() -> CronJob.builder("x").store(store).handler(ctx -> null).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("requires a schedule");
        assertThatThrownBy(() -> CronJob.builder("x").schedule("* * * * *").handler(ctx -> null).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("store");
        assertThatThrownBy(() -> CronJob.builder("x").schedule("* * * * *").store(store).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("handler or a workflow");
        assertThatThrownBy(() -> CronJob.builder("x").schedule("61 * * * *"))
                .isInstanceOf(InvalidCronExpressionException.class);
        assertThatThrownBy(() -> CronJob.builder("x").maxCatchUp(-1))
                .isInstanceOf(IllegalArgumentException.class);

        store.setReachable(false);
        assertThatThrownBy(() -> hourly("a").build()).isInstanceOf(IllegalStateException.class);
    }
}
