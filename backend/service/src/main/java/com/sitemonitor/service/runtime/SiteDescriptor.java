package com.sitemonitor.service.runtime;

import com.sitemonitor.sites.api.SiteAdapter;

import java.util.Objects;

public record SiteDescriptor(
        String id,
        String displayName,
        String description,
        String scheduleText,
        SiteAdapter adapter
) {
    public SiteDescriptor {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(displayName, "displayName is required");
        Objects.requireNonNull(scheduleText, "scheduleText is required");
        Objects.requireNonNull(adapter, "adapter is required");
        description = description == null ? "" : description;
    }

    public static SiteDescriptor of(SiteAdapter adapter) {
        return new SiteDescriptor(adapter.id(), adapter.displayName(), adapter.description(), adapter.schedule(), adapter);
    }
}
