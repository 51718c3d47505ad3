package net.kairos.core.job;

import net.kairos.core.cron.CronExpression;
import net.kairos.core.cron.NoMatchingTimeException;
import net.kairos.core.cron.ScanningCronCalculator;
import net.kairos.core.model.Execution;
import net.kairos.core.model.HistoryQuery;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobDefinition;
import net.kairos.core.service.CatchUpService;
import net.kairos.core.service.ExecutionLedger;
import net.kairos.core.service.Heartbeat;
import net.kairos.core.service.JobExecutor;
import net.kairos.core.service.JobRegistry;
import net.kairos.core.service.LeaseCoordinator;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.CronStore;
import net.kairos.core.spi.EventLog;
import net.kairos.core.spi.WorkflowLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 이름 붙은 cron job 하나. 인스턴스마다 자체 tick 루프를 돌리며, 여러 프로세스가 같은 job을
 * 동시에 돌려도 공유 저장소의 lease + ledger로 슬롯당 한 번만 실행된다.
 *
 * <pre>{@code
 * CronJob report = CronJob.builder("daily-report")
 *         .schedule("0 9 * * *")
 *         .timezone("America/New_York")
 *         .catchUp(true)
 *         .store(store)
 *         .handler(ctx -> reports.send(ctx.scheduledTime()))
 *         .build();
 * report.start();
 * }</pre>
 */
public final class CronJob {
    private static final Logger log = LoggerFactory.getLogger(CronJob.class);

    private final JobDefinition definition;
    private final CronHandler<?> handler;
    private final SchedulerSettings settings;
    private final String instanceId;
    private final Clock clock;
    private final CronCalculator cron;

    private final JobRegistry registry;
    private final LeaseCoordinator leases;
    private final ExecutionLedger ledger;
    private final JobExecutor executor;
    private final CatchUpService catchUp;

    private final Object lifecycle = new Object();
    private volatile boolean running;
    private ScheduledThreadPoolExecutor scheduler;
    private ScheduledFuture<?> tickFuture;

    private CronJob(Builder b, CronCalculator cron) {
        this.definition = new JobDefinition(b.name, b.cron, b.zone, b.catchUp, b.maxCatchUp);
        this.handler = b.handler;
        this.settings = b.settings;
        this.instanceId = b.instanceId;
        this.clock = b.clock;
        this.cron = cron;

        CronStore store = b.store;
        this.registry = new JobRegistry(store.jobs(), store.tx(), cron, clock);
        this.leases = new LeaseCoordinator(store.leases(), store.tx());
        this.ledger = new ExecutionLedger(store.executions(), store.tx(), store.codec());
        this.executor = new JobExecutor(ledger, store.sql(), b.eventLog, clock);
        this.catchUp = new CatchUpService(registry, ledger, executor, cron, clock);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    // --- lifecycle ---

    /**
     * job 행을 upsert 하고 tick 루프를 시작한다. catch-up이 켜져 있으면 스케줄러 스레드에서 먼저 수행하고,
     * 끝난 뒤에야 tick을 예약한다. 이미 실행 중이면 아무것도 하지 않음.
     */
    public void start() throws Exception {
        synchronized (lifecycle) {
            if (running) return;
            registry.register(definition);

            scheduler = new ScheduledThreadPoolExecutor(2, new NamedThreadFactory("kairos-" + definition.name()));
            scheduler.setRemoveOnCancelPolicy(true);
            // stop() 이후에도 진행 중 실행의 heartbeat는 실행이 끝날 때까지 유지
            scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(true);
            running = true;

            ScheduledThreadPoolExecutor s = scheduler;
            if (definition.catchUp()) {
                s.execute(() -> {
                    runCatchUp();
                    scheduleTicks(s);
                });
            } else {
                scheduleTicks(s);
            }
            log.info("Cron job '{}' started (schedule='{}', zone={}, instance={})",
                    definition.name(), definition.schedule(), definition.zone(), instanceId);
        }
    }

    /** 이후 tick만 멈춘다. 진행 중인 핸들러는 끝까지 실행되고 결과도 기록된다 */
    public void stop() {
        synchronized (lifecycle) {
            if (!running) return;
            running = false;
            if (tickFuture != null) tickFuture.cancel(false);
            if (scheduler != null) scheduler.shutdown();
            tickFuture = null;
            scheduler = null;
            log.info("Cron job '{}' stopped", definition.name());
        }
    }

    /** 그 사이 stop() 되었거나 재시작으로 풀이 바뀌었으면 예약하지 않음 */
    private void scheduleTicks(ScheduledThreadPoolExecutor s) {
        synchronized (lifecycle) {
            if (!running || scheduler != s) return;
            long period = settings.tickInterval().toMillis();
            tickFuture = s.scheduleWithFixedDelay(this::tickQuietly, period, period, TimeUnit.MILLISECONDS);
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** 실행 중이 아니면 empty */
    public Optional<Instant> nextRun() {
        if (!running) return Optional.empty();
        try {
            return Optional.of(cron.next(definition.cron(), clock.now(), definition.zone()));
        } catch (NoMatchingTimeException e) {
            return Optional.empty();
        }
    }

    // --- tick ---

    /**
     * tick 한 번: lease → due 확인 → ledger 선점 → 실행 → 커서 전진 → lease 반납.
     * 핸들러 실패와 저장소 오류 모두 여기서 흡수된다.
     */
    public TickOutcome tickOnce() {
        if (!running) return TickOutcome.STOPPED;
        String name = definition.name();
        if (!leases.tryAcquire(name, instanceId, settings.leaseDuration())) {
            return TickOutcome.LEASE_NOT_ACQUIRED;
        }
        try {
            Instant now = clock.now();
            Optional<Job> job = registry.find(name);
            if (job.isEmpty() || !job.get().isDue(now)) return TickOutcome.NOT_DUE;

            Instant due = job.get().nextScheduledTime();
            String executionId = name + "_" + due.toEpochMilli();
            boolean recorded = ledger.recordStart(executionId, name, due, now);
            if (recorded) {
                try (Heartbeat ignored = startHeartbeat()) {
                    executor.execute(name, handler, executionId, due, now);
                }
            }

            Instant following = cron.next(definition.cron(), due, definition.zone());
            registry.advance(name, due, following, due);
            return recorded ? TickOutcome.EXECUTED : TickOutcome.ALREADY_RECORDED;
        } catch (NoMatchingTimeException e) {
            log.error("Job '{}' has no next run; next_scheduled_time left unchanged: {}", name, e.getMessage());
            return TickOutcome.ABORTED;
        } catch (Exception e) {
            log.error("Tick failed for job '{}'", name, e);
            return TickOutcome.ABORTED;
        } finally {
            leases.release(name, instanceId);
        }
    }

    /** 예외가 빠져나가면 executor가 이후 tick을 모두 취소하므로 여기서 막는다 */
    private void tickQuietly() {
        try {
            tickOnce();
        } catch (Throwable t) {
            log.error("Unexpected error in tick loop of job '{}'", definition.name(), t);
        }
    }

    private Heartbeat startHeartbeat() {
        ScheduledThreadPoolExecutor s = scheduler;
        if (s == null) return Heartbeat.none();
        return Heartbeat.start(s, leases, definition.name(), instanceId,
                settings.leaseDuration(), settings.heartbeatInterval());
    }

    /** @return 실행한 슬롯 수 */
    public int catchUp() throws Exception {
        return catchUp.run(definition, handler);
    }

    private void runCatchUp() {
        try {
            catchUp();
        } catch (Throwable t) {
            log.error("Catch-up failed for job '{}'", definition.name(), t);
        }
    }

    // --- manual / query ---

    /**
     * 지금 시각을 슬롯으로 즉시 실행. lease와 due 확인을 건너뛰므로 동시 수동 실행끼리는 배제되지 않는다.
     * 핸들러가 실패해도 던지지 않고 FAILED 실행을 반환한다.
     */
    public Execution trigger() throws Exception {
        registry.ensureRegistered(definition);
        Instant now = clock.now();
        String executionId = definition.name() + "_manual_" + UUID.randomUUID();
        if (!ledger.recordStart(executionId, definition.name(), now, now)) {
            log.warn("Manual trigger of job '{}' collided with an execution at {}; running anyway", definition.name(), now);
        }
        return executor.execute(definition.name(), handler, executionId, now, now);
    }

    public List<Execution> history(HistoryQuery query) throws Exception {
        return ledger.history(definition.name(), query);
    }

    public List<Execution> history() throws Exception {
        return history(HistoryQuery.all());
    }

    /** 공유 저장소의 job 행 */
    public Optional<Job> state() throws Exception {
        return registry.find(definition.name());
    }

    public String name() { return definition.name(); }
    public JobDefinition definition() { return definition; }
    public String instanceId() { return instanceId; }
    public SchedulerSettings settings() { return settings; }

    @Override
    public String toString() {
        return "CronJob{" + definition.name() + " '" + definition.schedule() + "' " + definition.zone() + "}";
    }

    // --- builder ---

    public static final class Builder {
        private final String name;
        private CronExpression cron;
        private ZoneId zone = ZoneId.of("UTC");
        private boolean catchUp = false;
        private int maxCatchUp = 10;
        private CronHandler<?> handler;
        private CronStore store;
        private EventLog eventLog = EventLog.discarding();
        private Clock clock = Clock.system();
        private CronCalculator calculator;
        private SchedulerSettings settings = SchedulerSettings.defaults();
        private String instanceId = UUID.randomUUID().toString();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        /** 바로 파싱해서 잘못된 표현식은 여기서 실패한다 */
        public Builder schedule(String expression) {
            this.cron = CronExpression.parse(expression);
            return this;
        }

        public Builder timezone(String zoneId) {
            this.zone = ZoneId.of(zoneId);
            return this;
        }

        public Builder timezone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
            return this;
        }

        public Builder catchUp(boolean enabled) {
            this.catchUp = enabled;
            return this;
        }

        public Builder maxCatchUp(int count) {
            if (count < 0) throw new IllegalArgumentException("maxCatchUp must not be negative: " + count);
            this.maxCatchUp = count;
            return this;
        }

        public Builder handler(CronHandler<?> handler) {
            this.handler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public <I, O> Builder workflow(WorkflowLauncher<I, O> launcher, Function<CronContext, I> inputFn) {
            return handler(CronHandler.workflow(launcher, inputFn));
        }

        public Builder store(CronStore store) {
            this.store = Objects.requireNonNull(store, "store");
            return this;
        }

        public Builder eventLog(EventLog eventLog) {
            this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder calculator(CronCalculator calculator) {
            this.calculator = calculator;
            return this;
        }

        public Builder settings(SchedulerSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
            return this;
        }

        public CronJob build() {
            if (name.isBlank()) throw new IllegalStateException("Cron job name must not be blank");
            if (cron == null) {
                throw new IllegalStateException("Cron job '" + name + "' requires a schedule (use schedule())");
            }
            if (store == null) {
                throw new IllegalStateException("Cron job '" + name + "' requires a relational store (use store())");
            }
            if (handler == null) {
                throw new IllegalStateException("Cron job '" + name + "' requires either a handler or a workflow");
            }
            store.verify();
            CronCalculator c = calculator != null ? calculator : new ScanningCronCalculator(settings.maxSearchMinutes());
            return new CronJob(this, c);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
