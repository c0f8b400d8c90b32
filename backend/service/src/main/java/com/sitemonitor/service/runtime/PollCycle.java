package com.sitemonitor.service.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.sitemonitor.core.bus.EventBus;
import com.sitemonitor.core.events.AlertRaised;
import com.sitemonitor.core.events.ContentChanged;
import com.sitemonitor.core.events.PollCycleCompleted;
import com.sitemonitor.core.events.PollCycleStarted;
import com.sitemonitor.core.events.SiteFetched;
import com.sitemonitor.core.model.PollCycleOutcome;
import com.sitemonitor.service.notify.NotificationDispatcher;
import com.sitemonitor.service.store.SnapshotStore;
import com.sitemonitor.service.subscription.SubscriptionRegistry;
import com.sitemonitor.sites.api.SiteAdapter;
import com.sitemonitor.sites.api.SiteContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One fetch, compare, notify, persist pass for a single site. Never throws; every failure is
 * reported through the returned outcome, the log and the event bus.
 */
public class PollCycle {
    private static final Logger LOGGER = Logger.getLogger(PollCycle.class.getName());

    private final SnapshotStore snapshotStore;
    private final SubscriptionRegistry registry;
    private final NotificationDispatcher dispatcher;
    private final EventBus eventBus;
    private final SiteContext context;

    public PollCycle(
            SnapshotStore snapshotStore,
            SubscriptionRegistry registry,
            NotificationDispatcher dispatcher,
            EventBus eventBus,
            SiteContext context
    ) {
        this.snapshotStore = snapshotStore;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.context = context;
    }

    public PollCycleOutcome run(SiteDescriptor site) {
        Clock clock = context.clock();
        Instant started = clock.instant();
        eventBus.publish(new PollCycleStarted(started, site.id()));
        PollCycleOutcome outcome = runStages(site, clock);
        eventBus.publish(new PollCycleCompleted(
                clock.instant(),
                site.id(),
                outcome,
                Duration.between(started, clock.instant()).toMillis()
        ));
        return outcome;
    }

    private PollCycleOutcome runStages(SiteDescriptor site, Clock clock) {
        SiteAdapter adapter = site.adapter();
        JsonNode previous;
        try {
            previous = snapshotStore.load(site.id()).orElse(null);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed loading snapshot for " + site.id(), e);
            return PollCycleOutcome.FAILED;
        }

        Instant fetchStart = clock.instant();
        JsonNode latest;
        try {
            latest = await(adapter.fetch(context));
            if (latest == null) {
                throw new IllegalStateException("fetch returned no payload");
            }
        } catch (RuntimeException e) {
            String error = messageOf(e);
            long durationMillis = Duration.between(fetchStart, clock.instant()).toMillis();
            LOGGER.warning("Fetch failed for " + site.id() + ": " + error);
            eventBus.publish(new SiteFetched(clock.instant(), site.id(), false, durationMillis, error));
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "fetch",
                    "Fetch failed for " + site.displayName() + ": " + error,
                    Map.of("siteId", site.id())
            ));
            return PollCycleOutcome.FETCH_FAILED;
        }
        eventBus.publish(new SiteFetched(
                clock.instant(),
                site.id(),
                true,
                Duration.between(fetchStart, clock.instant()).toMillis(),
                null
        ));

        if (previous == null && !adapter.notifyOnFirstObservation()) {
            LOGGER.info("Stored first snapshot for " + site.id() + " without notifying");
            persist(site, latest, clock);
            return PollCycleOutcome.NO_CHANGE;
        }

        String text;
        try {
            if (!adapter.compare(previous, latest)) {
                LOGGER.fine("No change for " + site.id());
                return PollCycleOutcome.NO_CHANGE;
            }
            text = adapter.format(latest);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Compare/format failed for " + site.id(), e);
            return PollCycleOutcome.FAILED;
        }

        List<String> recipients = registry.subscribersOf(site.id());
        LOGGER.info("Update detected for " + site.id() + ", notifying " + recipients.size() + " recipient(s)");
        eventBus.publish(new ContentChanged(clock.instant(), site.id(), previous == null, recipients.size()));
        try {
            dispatcher.dispatch(site.id(), text, recipients);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Dispatch failed for " + site.id(), e);
        }

        persist(site, latest, clock);
        return PollCycleOutcome.CHANGED;
    }

    private void persist(SiteDescriptor site, JsonNode latest, Clock clock) {
        try {
            snapshotStore.save(site.id(), latest);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed saving snapshot for " + site.id(), e);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "persistence",
                    "Snapshot not saved for " + site.displayName() + ": " + messageOf(e),
                    Map.of("siteId", site.id())
            ));
        }
    }

    private static JsonNode await(CompletableFuture<JsonNode> pending) {
        if (pending == null) {
            throw new IllegalStateException("fetch returned no future");
        }
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching", e);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        }
    }

    private static String messageOf(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
