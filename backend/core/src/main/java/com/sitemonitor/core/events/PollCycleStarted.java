package com.sitemonitor.core.events;

import java.time.Instant;

public record PollCycleStarted(Instant timestamp, String siteId) implements Event {
    @Override
    public String type() {
        return "PollCycleStarted";
    }
}
