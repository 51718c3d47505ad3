package net.kairos.core.spi;

import net.kairos.core.model.Job;

import java.time.Instant;
import java.util.Optional;

public interface JobRepository {
    Optional<Job> findByName(String name) throws Exception;

    /**
     * 멱등 upsert (NAME 기준).
     * 기존 행이면 schedule/timezone/catch-up 설정과 NEXT_SCHEDULED_TIME만 덮어쓰고
     * ENABLED, LAST_SCHEDULED_TIME은 유지한다.
     */
    Job upsert(String name,
               String schedule,
               String timezone,
               boolean catchUp,
               int maxCatchUp,
               Instant nextScheduledTime) throws Exception;

    /**
     * 커서 전진: LAST=handled, NEXT=next.
     * expectedNext 가 null이 아니면 현재 NEXT_SCHEDULED_TIME이 그 값일 때만 갱신 (경합 시 0건).
     */
    boolean advance(String name, Instant handled, Instant next, Instant expectedNext) throws Exception;

    /** catch-up 이후 LAST_SCHEDULED_TIME만 옮김 (뒤로 가지 않음) */
    void markLastScheduled(String name, Instant lastScheduledTime) throws Exception;

    void setEnabled(String name, boolean enabled) throws Exception;
}
