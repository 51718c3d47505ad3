package net.kairos.core.model;

import java.time.Instant;

/** 실행 이력 조회 조건. since/limit 모두 선택 */
public record HistoryQuery(Instant since, Integer limit) {
    public static HistoryQuery all() { return new HistoryQuery(null, null); }

    public static HistoryQuery latest(int limit) { return new HistoryQuery(null, limit); }

    public HistoryQuery {
        if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
    }
}
