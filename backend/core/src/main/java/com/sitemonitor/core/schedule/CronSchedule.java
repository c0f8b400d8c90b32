package com.sitemonitor.core.schedule;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Standard five-field cron schedule with minute resolution, evaluated in the zone of the
 * instant it is asked about.
 */
public final class CronSchedule implements ScheduleSpec {
    private static final int SEARCH_YEARS = 5;

    private final String expression;
    private final CronField minute;
    private final CronField hour;
    private final CronField dayOfMonth;
    private final CronField month;
    private final CronField dayOfWeek;

    CronSchedule(
            String expression,
            CronField minute,
            CronField hour,
            CronField dayOfMonth,
            CronField month,
            CronField dayOfWeek
    ) {
        this.expression = Objects.requireNonNull(expression, "expression is required");
        this.minute = minute;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.month = month;
        this.dayOfWeek = dayOfWeek;
    }

    @Override
    public String expression() {
        return expression;
    }

    @Override
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        ZonedDateTime candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime limit = candidate.plusYears(SEARCH_YEARS);
        while (candidate.isBefore(limit)) {
            if (!month.matches(candidate.getMonthValue())) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hour.matches(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minute.matches(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private boolean dayMatches(ZonedDateTime candidate) {
        boolean domMatch = dayOfMonth.matches(candidate.getDayOfMonth());
        boolean dowMatch = dayOfWeek.matches(candidate.getDayOfWeek().getValue() % 7);
        if (dayOfMonth.restricted() && dayOfWeek.restricted()) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    public String minuteField() {
        return minute.text();
    }

    public String hourField() {
        return hour.text();
    }

    public String dayOfMonthField() {
        return dayOfMonth.text();
    }

    public String monthField() {
        return month.text();
    }

    public String dayOfWeekField() {
        return dayOfWeek.text();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CronSchedule that && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return "CronSchedule[" + expression + "]";
    }
}
