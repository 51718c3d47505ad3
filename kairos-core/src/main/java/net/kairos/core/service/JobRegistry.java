package net.kairos.core.service;

import net.kairos.core.model.Job;
import net.kairos.core.model.JobDefinition;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/** TB_CRON_JOB 에 대한 job 정의/커서 관리 */
public final class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final CronCalculator cron;
    private final Clock clock;

    public JobRegistry(JobRepository jobs, TxRunner tx, CronCalculator cron, Clock clock) {
        this.jobs = jobs;
        this.tx = tx;
        this.cron = cron;
        this.clock = clock;
    }

    /** upsert: NEXT_SCHEDULED_TIME = now 이후 첫 슬롯 */
    public Job register(JobDefinition def) throws Exception {
        Instant next = cron.next(def.cron(), clock.now(), def.zone());
        Job job = tx.required(() -> jobs.upsert(
                def.name(),
                def.schedule(),
                def.zone().getId(),
                def.catchUp(),
                def.maxCatchUp(),
                next));
        log.debug("Job registered: name='{}' schedule='{}' next={}", def.name(), def.schedule(), next);
        return job;
    }

    /** 행이 없을 때만 등록 (수동 실행의 FK 보장용, 기존 커서는 건드리지 않음) */
    public Job ensureRegistered(JobDefinition def) throws Exception {
        Optional<Job> existing = find(def.name());
        return existing.isPresent() ? existing.get() : register(def);
    }

    public Optional<Job> find(String name) throws Exception {
        return tx.required(() -> jobs.findByName(name));
    }

    /** 커서 전진. expected와 현재 NEXT가 다르면(다른 인스턴스가 이미 전진) false */
    public boolean advance(String name, Instant handled, Instant next, Instant expected) throws Exception {
        boolean moved = tx.required(() -> jobs.advance(name, handled, next, expected));
        if (!moved) {
            log.debug("Cursor for job '{}' already moved past {}", name, handled);
        }
        return moved;
    }

    public void markLastScheduled(String name, Instant last) throws Exception {
        tx.required(() -> { jobs.markLastScheduled(name, last); return null; });
    }

    public void setEnabled(String name, boolean enabled) throws Exception {
        tx.required(() -> { jobs.setEnabled(name, enabled); return null; });
        log.info("Job '{}' {}", name, enabled ? "enabled" : "disabled");
    }
}
