package net.kairos.core.spi;

import net.kairos.core.cron.CronExpression;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    /** after 보다 엄격히 뒤인 가장 이른 일치 시각 */
    Instant next(CronExpression cron, Instant after, ZoneId zone);

    /** before 보다 엄격히 앞인 가장 늦은 일치 시각 */
    Instant previous(CronExpression cron, Instant before, ZoneId zone);
}
