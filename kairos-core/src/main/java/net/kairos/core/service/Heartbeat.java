package net.kairos.core.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 실행 하나에 묶인 lease 연장 작업. try-with-resources 로 열고 닫는다.
 * 연장 실패는 로그만 남기고 실행은 계속된다.
 */
public final class Heartbeat implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Heartbeat.class);
    private static final Heartbeat NONE = new Heartbeat(null);

    private final ScheduledFuture<?> future;

    private Heartbeat(ScheduledFuture<?> future) {
        this.future = future;
    }

    public static Heartbeat start(ScheduledExecutorService scheduler,
                                  LeaseCoordinator leases,
                                  String jobName,
                                  String holderId,
                                  Duration lease,
                                  Duration interval) {
        Runnable beat = () -> {
            try {
                if (leases.renew(jobName, holderId, lease)) {
                    log.debug("Lease renewed for job '{}' by {}", jobName, holderId);
                } else {
                    log.warn("Lease for job '{}' is no longer held by {}; execution continues", jobName, holderId);
                }
            } catch (Exception e) {
                log.warn("Failed to renew lease for job '{}'; execution continues", jobName, e);
            }
        };
        try {
            long period = interval.toMillis();
            return new Heartbeat(scheduler.scheduleAtFixedRate(beat, period, period, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            // stop() 직후: 진행 중 실행은 끝까지 가되 연장은 하지 않음
            log.debug("Heartbeat for job '{}' not scheduled, scheduler is shutting down", jobName);
            return NONE;
        }
    }

    public static Heartbeat none() {
        return NONE;
    }

    public boolean active() {
        return future != null && !future.isDone();
    }

    @Override
    public void close() {
        if (future != null) future.cancel(false);
    }
}
