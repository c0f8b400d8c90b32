package com.sitemonitor.service.command;

import java.util.List;

public record SubscriptionListing(List<SiteSummary> subscribed, List<SiteSummary> unsubscribed) {
    public SubscriptionListing {
        subscribed = List.copyOf(subscribed);
        unsubscribed = List.copyOf(unsubscribed);
    }

    public String render() {
        if (subscribed.isEmpty() && unsubscribed.isEmpty()) {
            return "No sites available";
        }
        StringBuilder text = new StringBuilder("Subscriptions:\n");
        if (!subscribed.isEmpty()) {
            text.append("Subscribed:\n");
            subscribed.forEach(site -> appendLine(text, "✓", site));
            text.append('\n');
        }
        if (!unsubscribed.isEmpty()) {
            text.append("Not subscribed:\n");
            unsubscribed.forEach(site -> appendLine(text, "○", site));
        }
        return text.toString().stripTrailing();
    }

    private static void appendLine(StringBuilder text, String marker, SiteSummary site) {
        text.append(marker).append(' ').append(site.displayName());
        if (!site.description().isBlank()) {
            text.append(" - ").append(site.description());
        }
        text.append('\n');
    }
}
