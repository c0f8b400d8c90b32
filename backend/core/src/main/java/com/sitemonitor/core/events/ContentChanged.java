package com.sitemonitor.core.events;

import java.time.Instant;

public record ContentChanged(
        Instant timestamp,
        String siteId,
        boolean firstObservation,
        int recipientCount
) implements Event {
    @Override
    public String type() {
        return "ContentChanged";
    }
}
