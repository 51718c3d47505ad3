package net.kairos.core.job;

import net.kairos.core.cron.ScanningCronCalculator;

import java.time.Duration;
import java.util.Objects;

/**
 * tick 주기, lease 길이, heartbeat 주기, cron 탐색 상한.
 * heartbeat 미지정 시 lease의 1/3.
 */
public record SchedulerSettings(
        Duration tickInterval,
        Duration leaseDuration,
        Duration heartbeatInterval,
        long maxSearchMinutes
) {
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofSeconds(30);

    public SchedulerSettings {
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(leaseDuration, "leaseDuration");
        if (heartbeatInterval == null) heartbeatInterval = leaseDuration.dividedBy(3);
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (leaseDuration.isZero() || leaseDuration.isNegative()) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()
                || heartbeatInterval.compareTo(leaseDuration) >= 0) {
            throw new IllegalArgumentException("heartbeatInterval must be positive and shorter than leaseDuration");
        }
        if (maxSearchMinutes <= 0) throw new IllegalArgumentException("maxSearchMinutes must be positive");
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(DEFAULT_TICK_INTERVAL, DEFAULT_LEASE_DURATION, null,
                ScanningCronCalculator.DEFAULT_MAX_SEARCH_MINUTES);
    }

    public SchedulerSettings withTickInterval(Duration d) {
        return new SchedulerSettings(d, leaseDuration, heartbeatInterval, maxSearchMinutes);
    }

    public SchedulerSettings withLease(Duration lease, Duration heartbeat) {
        return new SchedulerSettings(tickInterval, lease, heartbeat, maxSearchMinutes);
    }
}
