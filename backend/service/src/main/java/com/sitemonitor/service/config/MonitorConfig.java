package com.sitemonitor.service.config;

import com.sitemonitor.service.subscription.SubscriptionRegistry;

import java.time.Duration;

public record MonitorConfig(
        String dataDir,
        String cacheDir,
        String journalFile,
        Duration requestTimeout,
        Integer workerThreads,
        String allToken,
        Boolean exampleSiteEnabled,
        TransportConfig transport
) {
    public MonitorConfig {
        dataDir = orDefault(dataDir, "data");
        cacheDir = orDefault(cacheDir, "cache");
        journalFile = orDefault(journalFile, "logs/events.jsonl");
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
        workerThreads = workerThreads == null ? 4 : workerThreads;
        allToken = orDefault(allToken, SubscriptionRegistry.DEFAULT_ALL_TOKEN);
        exampleSiteEnabled = exampleSiteEnabled != null && exampleSiteEnabled;
        transport = transport == null ? TransportConfig.logging() : transport;
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(null, null, null, null, null, null, null, null);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
