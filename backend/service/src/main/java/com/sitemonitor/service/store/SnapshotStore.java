package com.sitemonitor.service.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Last-known payload per site. Snapshots are replaced wholesale, never merged.
 */
public interface SnapshotStore {
    Optional<JsonNode> load(String siteId);

    /**
     * @throws IllegalStateException when the snapshot could not be written
     */
    void save(String siteId, JsonNode payload);
}
