package net.kairos.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.kairos.core.cron.CronExpression;
import net.kairos.core.cron.NoMatchingTimeException;
import net.kairos.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * cron-utils(UNIX 정의) 기반 계산기. kairos.scheduler.cron-engine=cron-utils 일 때 사용.
 * 기본 스캐너와 달리 day-of-month와 day-of-week가 둘 다 제한되면 OR로 해석한다 (vixie cron).
 */
public final class CronUtilsCalculator implements CronCalculator {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // 간단 LRU(최대 256개)
    private final Map<String, ExecutionTime> cache = new LruMap<>(256);

    @Override
    public Instant next(CronExpression cron, Instant after, ZoneId zone) {
        Objects.requireNonNull(after); Objects.requireNonNull(zone);
        ZonedDateTime base = after.atZone(zone);
        return executionTime(cron).nextExecution(base)
                .map(t -> t.truncatedTo(ChronoUnit.MINUTES).toInstant())
                .orElseThrow(() -> new NoMatchingTimeException(cron.expression(), "next"));
    }

    @Override
    public Instant previous(CronExpression cron, Instant before, ZoneId zone) {
        Objects.requireNonNull(before); Objects.requireNonNull(zone);
        ZonedDateTime base = before.atZone(zone);
        return executionTime(cron).lastExecution(base)
                .map(t -> t.truncatedTo(ChronoUnit.MINUTES).toInstant())
                .orElseThrow(() -> new NoMatchingTimeException(cron.expression(), "previous"));
    }

    private ExecutionTime executionTime(CronExpression cron) {
        synchronized (cache) {
            return cache.computeIfAbsent(cron.expression(), expr -> ExecutionTime.forCron(PARSER.parse(expr)));
        }
    }

    public void invalidateAll() {
        synchronized (cache) { cache.clear(); }
    }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
