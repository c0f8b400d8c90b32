package com.sitemonitor.sites.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * One watched external source. The scheduler calls {@link #fetch} on every firing, hands the
 * result and the stored snapshot to {@link #compare}, and on a positive answer renders the
 * notification with {@link #format} before replacing the snapshot.
 *
 * <p>{@link #compare} and {@link #format} must be pure: same inputs, same answer, no side effects.
 */
public interface SiteAdapter {
    /**
     * Stable key for snapshots, subscriptions and jobs. Letters, digits, {@code _} and {@code -}.
     */
    String id();

    String displayName();

    String description();

    /**
     * Either {@code interval:<seconds>} or a five-field cron expression. Read once, at registration.
     */
    String schedule();

    /**
     * Retrieves the current state of the source. A failed future (or a thrown exception) aborts
     * the current cycle only; the stored snapshot stays as it was.
     */
    CompletableFuture<JsonNode> fetch(SiteContext ctx);

    /**
     * True when {@code latest} is new content relative to {@code previous}. {@code previous} is
     * null on the first observation, in which case the answer must be true.
     */
    boolean compare(JsonNode previous, JsonNode latest);

    String format(JsonNode latest);

    /**
     * Adapters that must not announce the state they find on their very first poll return false;
     * the first payload is then stored as a silent baseline and {@link #compare} is not consulted.
     */
    default boolean notifyOnFirstObservation() {
        return true;
    }
}
