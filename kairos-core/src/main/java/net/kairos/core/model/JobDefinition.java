package net.kairos.core.model;

import net.kairos.core.cron.CronExpression;

import java.time.ZoneId;
import java.util.Objects;

/** 빌더에서 검증이 끝난, 프로세스 내 job 정의 */
public record JobDefinition(
        String name,
        CronExpression cron,
        ZoneId zone,
        boolean catchUp,
        int maxCatchUp
) {
    public JobDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cron, "cron");
        Objects.requireNonNull(zone, "zone");
        if (name.isBlank()) throw new IllegalArgumentException("job name must not be blank");
        if (maxCatchUp < 0) throw new IllegalArgumentException("maxCatchUp must not be negative: " + maxCatchUp);
    }

    public String schedule() {
        return cron.expression();
    }
}
