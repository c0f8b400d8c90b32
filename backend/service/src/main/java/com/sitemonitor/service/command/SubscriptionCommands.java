package com.sitemonitor.service.command;

import com.sitemonitor.service.runtime.SiteDescriptor;
import com.sitemonitor.service.runtime.SiteScheduler;
import com.sitemonitor.service.subscription.SubscriptionRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chat-facing subscription commands. Sites are addressed by display name or by the all-sites
 * token; every outcome, failures included, becomes a short reply.
 */
public class SubscriptionCommands {
    private static final Logger LOGGER = Logger.getLogger(SubscriptionCommands.class.getName());
    static final String ALL_SITES_DESCRIPTION = "Every site, including ones added later";

    private final SubscriptionRegistry registry;
    private final SiteScheduler scheduler;

    public SubscriptionCommands(SubscriptionRegistry registry, SiteScheduler scheduler) {
        this.registry = registry;
        this.scheduler = scheduler;
    }

    public String subscribe(String recipient, String siteName, boolean isGroup) {
        if (siteName == null || siteName.isBlank()) {
            return "Please name the site to subscribe to.";
        }
        String name = siteName.strip();
        Optional<String> siteId = resolve(name);
        if (siteId.isEmpty()) {
            return "Unknown site: " + name;
        }
        try {
            return registry.subscribe(recipient, siteId.get(), isGroup)
                    ? kind(isGroup) + " " + recipient + " subscribed to " + name
                    : kind(isGroup) + " " + recipient + " is already subscribed to " + name;
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Subscribe " + recipient + " to " + name + " failed", e);
            return "Could not subscribe to " + name + ", please try again later.";
        }
    }

    public String unsubscribe(String recipient, String siteName, boolean isGroup) {
        if (siteName == null || siteName.isBlank()) {
            return "Please name the site to unsubscribe from.";
        }
        String name = siteName.strip();
        Optional<String> siteId = resolve(name);
        if (siteId.isEmpty()) {
            return "Unknown site: " + name;
        }
        try {
            return registry.unsubscribe(recipient, siteId.get(), isGroup)
                    ? kind(isGroup) + " " + recipient + " unsubscribed from " + name
                    : kind(isGroup) + " " + recipient + " is not subscribed to " + name;
        } catch (IllegalStateException e) {
            LOGGER.log(Level.WARNING, "Unsubscribe " + recipient + " from " + name + " failed", e);
            return "Could not unsubscribe from " + name + ", please try again later.";
        }
    }

    public SubscriptionListing listSubscriptions(String recipient, boolean isGroup) {
        Set<String> current = registry.subscriptionsOf(recipient, isGroup);
        List<SiteSummary> subscribed = new ArrayList<>();
        List<SiteSummary> unsubscribed = new ArrayList<>();
        if (current.contains(registry.allToken())) {
            subscribed.add(new SiteSummary(registry.allToken(), ALL_SITES_DESCRIPTION));
        }
        for (SiteDescriptor site : scheduler.sites()) {
            SiteSummary summary = new SiteSummary(site.displayName(), site.description());
            if (current.contains(site.id())) {
                subscribed.add(summary);
            } else {
                unsubscribed.add(summary);
            }
        }
        return new SubscriptionListing(subscribed, unsubscribed);
    }

    private Optional<String> resolve(String siteName) {
        if (registry.isAllToken(siteName)) {
            return Optional.of(siteName);
        }
        return scheduler.findByDisplayName(siteName).map(SiteDescriptor::id);
    }

    private static String kind(boolean isGroup) {
        return isGroup ? "Group" : "User";
    }
}
