package net.kairos.core.service;

import net.kairos.core.cron.NoMatchingTimeException;
import net.kairos.core.job.CronHandler;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobDefinition;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * 재시작 시 놓친 슬롯을 최대 maxCatchUp 개까지 동기 실행.
 * lease는 잡지 않는다. 여러 인스턴스가 동시에 돌아도 ledger 유니크 제약으로 슬롯당 한 번만 실행된다.
 * 상한을 넘는 나머지는 건너뛴다 (소규모 복구용이지 무한 backfill이 아님).
 */
public final class CatchUpService {
    private static final Logger log = LoggerFactory.getLogger(CatchUpService.class);

    private final JobRegistry registry;
    private final ExecutionLedger ledger;
    private final JobExecutor executor;
    private final CronCalculator cron;
    private final Clock clock;

    public CatchUpService(JobRegistry registry,
                          ExecutionLedger ledger,
                          JobExecutor executor,
                          CronCalculator cron,
                          Clock clock) {
        this.registry = registry;
        this.ledger = ledger;
        this.executor = executor;
        this.cron = cron;
        this.clock = clock;
    }

    /** @return 이번에 실행한 슬롯 수 */
    public int run(JobDefinition def, CronHandler<?> handler) throws Exception {
        if (!def.catchUp() || def.maxCatchUp() == 0) return 0;

        Optional<Job> job = registry.find(def.name());
        Instant last = job.map(Job::lastScheduledTime).orElse(null);
        if (last == null) {
            log.debug("No previous run recorded for job '{}', nothing to catch up", def.name());
            return 0;
        }

        Instant now = clock.now();
        try {
            Instant latest = cron.previous(def.cron(), now, def.zone());
            if (!latest.isAfter(last)) return 0;
        } catch (NoMatchingTimeException e) {
            return 0;
        }

        Instant cursor = last;
        int count = 0;
        boolean truncated = false;
        while (true) {
            Instant next = cron.next(def.cron(), cursor, def.zone());
            if (!next.isBefore(now)) break;
            if (count >= def.maxCatchUp()) {
                truncated = true;
                break;
            }
            if (!ledger.exists(def.name(), next)) {
                String executionId = def.name() + "_catchup_" + next.toEpochMilli();
                if (ledger.recordStart(executionId, def.name(), next, clock.now())) {
                    log.info("Catching up missed execution of job '{}' at {}", def.name(), next);
                    executor.execute(def.name(), handler, executionId, next, clock.now());
                    count++;
                }
            }
            cursor = next;
        }

        if (cursor.isAfter(last)) {
            registry.markLastScheduled(def.name(), cursor);
        }
        if (count > 0) {
            log.info("Caught up {} missed execution(s) of job '{}'", count, def.name());
        }
        if (truncated) {
            log.info("Catch-up limit {} reached for job '{}'; older misses after {} are skipped",
                    def.maxCatchUp(), def.name(), cursor);
        }
        return count;
    }
}
