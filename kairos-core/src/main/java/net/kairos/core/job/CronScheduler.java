package net.kairos.core.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 프로세스 안의 cron job 목록. 전역 상태 대신 명시적으로 만들어 주입한다.
 * 같은 이름을 두 번 등록하면 실패한다.
 */
public final class CronScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    private final Map<String, CronJob> jobs = new LinkedHashMap<>();

    public synchronized CronJob register(CronJob job) {
        if (jobs.containsKey(job.name())) {
            throw new IllegalStateException("Cron job '" + job.name() + "' is already registered");
        }
        jobs.put(job.name(), job);
        log.debug("Cron job '{}' added to scheduler", job.name());
        return job;
    }

    public synchronized Optional<CronJob> job(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    public synchronized Collection<CronJob> jobs() {
        return Collections.unmodifiableList(new ArrayList<>(jobs.values()));
    }

    /** 하나가 실패해도 나머지는 시작. 첫 예외를 마지막에 던진다 */
    public void startAll() throws Exception {
        Exception first = null;
        for (CronJob job : jobs()) {
            try {
                job.start();
            } catch (Exception e) {
                log.error("Failed to start cron job '{}'", job.name(), e);
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }

    public void stopAll() {
        for (CronJob job : jobs()) {
            job.stop();
        }
    }

    @Override
    public void close() {
        stopAll();
    }
}
