package net.kairos.core.cron;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 5필드 cron 표현식 (minute hour day-of-month month day-of-week).
 * <p>
 * 각 필드는 콤마로 구분된 토큰의 목록이며 토큰은 다음 중 하나:
 * {@code *}, {@code n}, {@code a-b}, {@code *&#47;c}, {@code a/c}, {@code a-b/c}.
 * 범위를 벗어난 값은 잘려 나가고, 결과가 비어 있는 필드는 오류로 본다.
 * day-of-month와 day-of-week는 AND로 결합된다.
 */
public final class CronExpression {
    private static final Pattern TOKEN = Pattern.compile("^(\\*|\\d+|\\d+-\\d+)(?:/(\\d+))?$");

    private final String expression;
    private final Map<CronField, SortedSet<Integer>> fields;

    private CronExpression(String expression, Map<CronField, SortedSet<Integer>> fields) {
        this.expression = expression;
        this.fields = fields;
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is empty");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new InvalidCronExpressionException(expression, "expected 5 fields, got " + parts.length);
        }

        Map<CronField, SortedSet<Integer>> parsed = new EnumMap<>(CronField.class);
        CronField[] order = CronField.values();
        for (int i = 0; i < order.length; i++) {
            parsed.put(order[i], parseField(expression, parts[i], order[i]));
        }
        return new CronExpression(expression.trim(), parsed);
    }

    /** 검증만 필요할 때 (파싱 결과는 버림) */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    private static SortedSet<Integer> parseField(String expression, String field, CronField f) {
        SortedSet<Integer> values = new TreeSet<>();
        for (String token : field.split(",", -1)) {
            Matcher m = TOKEN.matcher(token);
            if (!m.matches()) {
                throw new InvalidCronExpressionException(expression,
                        "unrecognized token '" + token + "' in " + f.name().toLowerCase() + " field");
            }
            String range = m.group(1);
            int step = 1;
            if (m.group(2) != null) {
                step = toInt(expression, m.group(2));
                if (step <= 0) {
                    throw new InvalidCronExpressionException(expression, "step must be positive in '" + token + "'");
                }
            }

            int start;
            int end;
            if (range.equals("*")) {
                start = f.min();
                end = f.max();
            } else if (range.contains("-")) {
                String[] ab = range.split("-");
                start = toInt(expression, ab[0]);
                end = toInt(expression, ab[1]);
            } else {
                start = toInt(expression, range);
                // 'a/c' 는 a부터 필드 최대값까지, 단일 값 'n' 은 n 하나
                end = m.group(2) != null ? f.max() : start;
            }

            // 끝만 필드 최대값으로 자른다. 시작값은 step 기준이라 유지
            int last = Math.min(end, f.max());
            for (long v = start; v <= last; v += step) {
                if (f.inRange((int) v)) values.add((int) v);
            }
        }
        if (values.isEmpty()) {
            throw new InvalidCronExpressionException(expression,
                    "no value within " + f.min() + "-" + f.max() + " in " + f.name().toLowerCase() + " field '" + field + "'");
        }
        return Collections.unmodifiableSortedSet(values);
    }

    private static int toInt(String expression, String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new InvalidCronExpressionException(expression, "number out of range: " + s);
        }
    }

    public String expression() { return expression; }

    public SortedSet<Integer> values(CronField field) { return fields.get(field); }

    public SortedSet<Integer> minute() { return values(CronField.MINUTE); }
    public SortedSet<Integer> hour() { return values(CronField.HOUR); }
    public SortedSet<Integer> dayOfMonth() { return values(CronField.DAY_OF_MONTH); }
    public SortedSet<Integer> month() { return values(CronField.MONTH); }
    public SortedSet<Integer> dayOfWeek() { return values(CronField.DAY_OF_WEEK); }

    /** 다섯 필드가 모두 일치하는지 (초 이하 단위는 보지 않음) */
    public boolean matches(ZonedDateTime t) {
        for (CronField f : CronField.values()) {
            if (!fields.get(f).contains(f.valueOf(t))) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronExpression that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return expression;
    }
}
