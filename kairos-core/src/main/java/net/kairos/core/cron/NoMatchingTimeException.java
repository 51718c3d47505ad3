package net.kairos.core.cron;

/** 탐색 상한(분 단위) 안에서 일치하는 시각을 찾지 못함 */
public class NoMatchingTimeException extends IllegalStateException {
    public NoMatchingTimeException(String expression, String direction, long searchedMinutes) {
        super("Could not find " + direction + " time for [" + expression + "] within " + searchedMinutes + " minutes");
    }

    /** 탐색 상한이 없는 계산기용 */
    public NoMatchingTimeException(String expression, String direction) {
        super("Could not find " + direction + " time for [" + expression + "]");
    }
}
