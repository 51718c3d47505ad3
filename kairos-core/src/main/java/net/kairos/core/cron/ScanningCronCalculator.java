package net.kairos.core.cron;

import net.kairos.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * 분 단위 전수 탐색 계산기.
 * dom/dow 결합처럼 역산이 까다로운 조합도 그대로 평가한다. 탐색은 maxSearchMinutes 로 제한되며
 * 초과하면 {@link NoMatchingTimeException}.
 */
public final class ScanningCronCalculator implements CronCalculator {
    /** 1년치 분 */
    public static final long DEFAULT_MAX_SEARCH_MINUTES = 525_600L;

    private final long maxSearchMinutes;

    public ScanningCronCalculator() {
        this(DEFAULT_MAX_SEARCH_MINUTES);
    }

    public ScanningCronCalculator(long maxSearchMinutes) {
        if (maxSearchMinutes <= 0) throw new IllegalArgumentException("maxSearchMinutes must be positive");
        this.maxSearchMinutes = maxSearchMinutes;
    }

    public long maxSearchMinutes() {
        return maxSearchMinutes;
    }

    @Override
    public Instant next(CronExpression cron, Instant after, ZoneId zone) {
        Instant t = after.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        for (long i = 0; i < maxSearchMinutes; i++) {
            if (cron.matches(t.atZone(zone))) return t;
            t = t.plus(1, ChronoUnit.MINUTES);
        }
        throw new NoMatchingTimeException(cron.expression(), "next", maxSearchMinutes);
    }

    @Override
    public Instant previous(CronExpression cron, Instant before, ZoneId zone) {
        Instant t = before.truncatedTo(ChronoUnit.MINUTES);
        // 분 경계에 정확히 걸친 before 자신은 제외
        if (t.equals(before)) t = t.minus(1, ChronoUnit.MINUTES);
        for (long i = 0; i < maxSearchMinutes; i++) {
            if (cron.matches(t.atZone(zone))) return t;
            t = t.minus(1, ChronoUnit.MINUTES);
        }
        throw new NoMatchingTimeException(cron.expression(), "previous", maxSearchMinutes);
    }
}
