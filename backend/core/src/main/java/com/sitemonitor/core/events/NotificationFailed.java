package com.sitemonitor.core.events;

import java.time.Instant;

public record NotificationFailed(
        Instant timestamp,
        String siteId,
        String recipient,
        String reason
) implements Event {
    @Override
    public String type() {
        return "NotificationFailed";
    }
}
