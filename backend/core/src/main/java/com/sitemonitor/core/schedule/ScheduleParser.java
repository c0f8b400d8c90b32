package com.sitemonitor.core.schedule;

import java.time.Duration;
import java.util.Map;

/**
 * Parses site schedule text. Two forms are accepted:
 * <ul>
 *     <li>{@code interval:<seconds>} with a positive whole number of seconds;</li>
 *     <li>a five-field cron expression {@code minute hour day-of-month month day-of-week}.</li>
 * </ul>
 * Day-of-week runs 0-7 with both 0 and 7 meaning Sunday.
 */
public final class ScheduleParser {
    public static final String INTERVAL_PREFIX = "interval:";
    // Largest period that still fits in milliseconds.
    static final long MAX_INTERVAL_SECONDS = Long.MAX_VALUE / 1000;

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("APR", 4),
            Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AUG", 8),
            Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12)
    );
    private static final Map<String, Integer> DAYS = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6
    );

    private ScheduleParser() {
    }

    public static ScheduleSpec parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleParseException(String.valueOf(expression), "schedule is empty");
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith(INTERVAL_PREFIX)) {
            return parseInterval(trimmed);
        }
        return parseCron(trimmed);
    }

    private static IntervalSchedule parseInterval(String expression) {
        String seconds = expression.substring(INTERVAL_PREFIX.length()).trim();
        if (seconds.isEmpty() || !seconds.chars().allMatch(Character::isDigit)) {
            throw new ScheduleParseException(expression, "interval must be a positive whole number of seconds");
        }
        long value;
        try {
            value = Long.parseLong(seconds);
        } catch (NumberFormatException e) {
            throw new ScheduleParseException(expression, "interval is too large", e);
        }
        if (value <= 0) {
            throw new ScheduleParseException(expression, "interval must be a positive whole number of seconds");
        }
        if (value > MAX_INTERVAL_SECONDS) {
            throw new ScheduleParseException(expression, "interval is too large");
        }
        return new IntervalSchedule(expression, Duration.ofSeconds(value));
    }

    private static CronSchedule parseCron(String expression) {
        String[] fields = expression.split("\\s+");
        if (fields.length != 5) {
            throw new ScheduleParseException(expression, "expected 5 cron fields but found " + fields.length);
        }
        try {
            return new CronSchedule(
                    expression,
                    CronField.parse("minute", fields[0], 0, 59, Map.of()),
                    CronField.parse("hour", fields[1], 0, 23, Map.of()),
                    CronField.parse("day-of-month", fields[2], 1, 31, Map.of()),
                    CronField.parse("month", fields[3], 1, 12, MONTHS),
                    CronField.parse("day-of-week", fields[4], 0, 7, DAYS).alias(7, 0)
            );
        } catch (IllegalArgumentException e) {
            throw new ScheduleParseException(expression, e.getMessage(), e);
        }
    }
}
