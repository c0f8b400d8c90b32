package com.sitemonitor.service.runtime;

import com.sitemonitor.service.subscription.SubscriptionRegistry;
import com.sitemonitor.sites.api.SiteAdapter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Validates adapters and registers them with the scheduler. A rejected adapter is logged and
 * skipped; the others still load.
 */
public class SiteLoader {
    private static final Logger LOGGER = Logger.getLogger(SiteLoader.class.getName());
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private final SiteScheduler scheduler;
    private final String allToken;

    public SiteLoader(SiteScheduler scheduler, String allToken) {
        this.scheduler = scheduler;
        this.allToken = allToken;
    }

    public List<String> load(List<SiteAdapter> adapters) {
        List<String> loaded = new ArrayList<>();
        Set<String> displayNames = new HashSet<>();
        for (SiteDescriptor existing : scheduler.sites()) {
            displayNames.add(existing.displayName());
        }

        for (int index = 0; index < adapters.size(); index++) {
            SiteAdapter adapter = adapters.get(index);
            try {
                SiteDescriptor descriptor = validate(describe(adapter), displayNames);
                scheduler.register(descriptor);
                displayNames.add(descriptor.displayName());
                loaded.add(descriptor.id());
                LOGGER.info("Loaded site " + descriptor.id() + " (" + descriptor.displayName() + ")");
            } catch (AdapterLoadException e) {
                LOGGER.warning("Skipping site " + e.siteId() + ": " + e.getMessage());
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Skipping adapter #" + index + " (" + typeOf(adapter) + ")", e);
            }
        }
        return loaded;
    }

    // Accessors are read once per load.
    private static Candidate describe(SiteAdapter adapter) {
        if (adapter == null) {
            throw new AdapterLoadException(null, "adapter is null");
        }
        return new Candidate(adapter.id(), adapter.displayName(), adapter.description(), adapter.schedule(), adapter);
    }

    private SiteDescriptor validate(Candidate candidate, Set<String> displayNames) {
        String id = candidate.id();
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new AdapterLoadException(id, "id must match " + ID_PATTERN.pattern());
        }
        if (SubscriptionRegistry.ALL_SITES_ID.equals(id) || id.equals(allToken)) {
            throw new AdapterLoadException(id, "id '" + id + "' is reserved");
        }
        String displayName = candidate.displayName();
        if (displayName == null || displayName.isBlank()) {
            throw new AdapterLoadException(id, "display name is blank");
        }
        if (displayName.equals(allToken)) {
            throw new AdapterLoadException(id, "display name '" + displayName + "' is reserved");
        }
        if (candidate.schedule() == null) {
            throw new AdapterLoadException(id, "schedule is missing");
        }
        if (scheduler.site(id).isPresent()) {
            throw new AdapterLoadException(id, "duplicate site id");
        }
        if (displayNames.contains(displayName)) {
            throw new AdapterLoadException(id, "duplicate display name '" + displayName + "'");
        }
        return new SiteDescriptor(id, displayName, candidate.description(), candidate.schedule(), candidate.adapter());
    }

    private static String typeOf(SiteAdapter adapter) {
        return adapter == null ? "null" : adapter.getClass().getName();
    }

    private record Candidate(String id, String displayName, String description, String schedule, SiteAdapter adapter) {
    }
}
