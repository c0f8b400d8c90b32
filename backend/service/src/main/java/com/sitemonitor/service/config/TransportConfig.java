package com.sitemonitor.service.config;

import java.util.List;
import java.util.Locale;

/**
 * {@code type} is {@code log} (default) or {@code onebot}; {@code baseUrl} and {@code accessToken}
 * only apply to {@code onebot}, {@code knownGroups} only to {@code log}.
 */
public record TransportConfig(String type, String baseUrl, String accessToken, List<String> knownGroups) {
    public static final String LOG = "log";
    public static final String ONEBOT = "onebot";

    public TransportConfig {
        type = type == null || type.isBlank() ? LOG : type.strip().toLowerCase(Locale.ROOT);
        knownGroups = knownGroups == null ? List.of() : List.copyOf(knownGroups);
        if (!LOG.equals(type) && !ONEBOT.equals(type)) {
            throw new IllegalArgumentException("Unknown transport type: " + type);
        }
        if (ONEBOT.equals(type) && (baseUrl == null || baseUrl.isBlank())) {
            throw new IllegalArgumentException("transport.baseUrl is required for onebot");
        }
    }

    public static TransportConfig logging() {
        return new TransportConfig(LOG, null, null, List.of());
    }
}
