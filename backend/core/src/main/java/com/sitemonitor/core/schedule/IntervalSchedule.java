package com.sitemonitor.core.schedule;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

public record IntervalSchedule(String expression, Duration period) implements ScheduleSpec {
    public IntervalSchedule {
        Objects.requireNonNull(expression, "expression is required");
        Objects.requireNonNull(period, "period is required");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
    }

    @Override
    public Optional<ZonedDateTime> nextFireAfter(ZonedDateTime after) {
        return Optional.of(after.plus(period));
    }
}
