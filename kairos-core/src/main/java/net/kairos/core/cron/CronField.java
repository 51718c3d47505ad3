package net.kairos.core.cron;

import java.time.ZonedDateTime;

/** 5필드 cron의 각 필드와 허용 범위 */
public enum CronField {
    MINUTE(0, 59),
    HOUR(0, 23),
    DAY_OF_MONTH(1, 31),
    MONTH(1, 12),
    DAY_OF_WEEK(0, 6);   // 일요일 = 0

    private final int min;
    private final int max;

    CronField(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int min() { return min; }
    public int max() { return max; }

    public boolean inRange(int value) {
        return value >= min && value <= max;
    }

    /** 주어진 시각에서 이 필드의 값을 뽑아낸다 */
    public int valueOf(ZonedDateTime t) {
        return switch (this) {
            case MINUTE -> t.getMinute();
            case HOUR -> t.getHour();
            case DAY_OF_MONTH -> t.getDayOfMonth();
            case MONTH -> t.getMonthValue();
            case DAY_OF_WEEK -> t.getDayOfWeek().getValue() % 7; // java: 월=1..일=7
        };
    }
}
