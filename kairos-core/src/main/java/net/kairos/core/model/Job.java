package net.kairos.core.model;

import java.time.Instant;

public record Job(
        String name,
        String schedule,
        String timezone,
        boolean catchUp,
        int maxCatchUp,
        boolean enabled,
        Instant lastScheduledTime,   // null = 아직 한 번도 처리되지 않음
        Instant nextScheduledTime,
        Instant createdAt,
        Instant updatedAt
) {
    public static Job ofNew(String name, String schedule, String timezone,
                            boolean catchUp, int maxCatchUp, Instant nextScheduledTime) {
        return new Job(name, schedule, timezone, catchUp, maxCatchUp, true,
                null, nextScheduledTime, null, null);
    }

    /** next가 존재하고 now 이전(또는 같음)이면 due */
    public boolean isDue(Instant now) {
        return enabled && nextScheduledTime != null && !nextScheduledTime.isAfter(now);
    }
}
