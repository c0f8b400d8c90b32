package com.sitemonitor.core.events;

import com.sitemonitor.core.model.RecipientKind;

import java.time.Instant;

public record NotificationSent(
        Instant timestamp,
        String siteId,
        String recipient,
        RecipientKind kind
) implements Event {
    @Override
    public String type() {
        return "NotificationSent";
    }
}
