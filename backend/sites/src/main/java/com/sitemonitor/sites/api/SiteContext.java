package com.sitemonitor.sites.api;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public record SiteContext(
        HttpClient httpClient,
        Clock clock,
        Duration requestTimeout,
        SnapshotLookup snapshots
) {
    public SiteContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        Objects.requireNonNull(snapshots, "snapshots is required");
    }
}
