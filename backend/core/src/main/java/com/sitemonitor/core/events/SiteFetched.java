package com.sitemonitor.core.events;

import java.time.Instant;

public record SiteFetched(
        Instant timestamp,
        String siteId,
        boolean success,
        long durationMillis,
        String error
) implements Event {
    @Override
    public String type() {
        return "SiteFetched";
    }
}
