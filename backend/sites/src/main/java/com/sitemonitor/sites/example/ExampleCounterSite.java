package com.sitemonitor.sites.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitemonitor.core.util.JsonUtils;
import com.sitemonitor.sites.api.SiteAdapter;
import com.sitemonitor.sites.api.SiteContext;

import java.util.concurrent.CompletableFuture;

/**
 * Synthetic source that reports one more update every time it is polled. Used to check the
 * notification path end to end without any network access.
 */
public class ExampleCounterSite implements SiteAdapter {
    public static final String ID = "example";
    static final String COUNT_FIELD = "update_count";

    private final String schedule;

    public ExampleCounterSite() {
        this("interval:10");
    }

    public ExampleCounterSite(String schedule) {
        this.schedule = schedule;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Example";
    }

    @Override
    public String description() {
        return "Example site - publishes a new update on every poll, for testing";
    }

    @Override
    public String schedule() {
        return schedule;
    }

    @Override
    public CompletableFuture<JsonNode> fetch(SiteContext ctx) {
        int previousCount = ctx.snapshots().lookup(ID)
                .map(snapshot -> snapshot.path(COUNT_FIELD).asInt(0))
                .orElse(0);
        int next = previousCount + 1;

        ObjectNode payload = JsonUtils.objectMapper().createObjectNode();
        payload.put("timestamp", ctx.clock().instant().toString());
        payload.put(COUNT_FIELD, next);
        payload.put("title", "Example Update #" + next);
        payload.put("content", "This is example content for update #" + next);
        return CompletableFuture.completedFuture(payload);
    }

    @Override
    public boolean compare(JsonNode previous, JsonNode latest) {
        if (previous == null) {
            return true;
        }
        return latest.path(COUNT_FIELD).asInt(0) > previous.path(COUNT_FIELD).asInt(0);
    }

    @Override
    public String format(JsonNode latest) {
        return "【Example site update】\n"
                + latest.path("title").asText("Unknown update") + "\n"
                + latest.path("content").asText("");
    }
}
