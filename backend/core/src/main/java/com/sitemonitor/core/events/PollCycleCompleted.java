package com.sitemonitor.core.events;

import com.sitemonitor.core.model.PollCycleOutcome;

import java.time.Instant;

public record PollCycleCompleted(
        Instant timestamp,
        String siteId,
        PollCycleOutcome outcome,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "PollCycleCompleted";
    }
}
