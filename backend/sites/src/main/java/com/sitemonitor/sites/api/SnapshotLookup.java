package com.sitemonitor.sites.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Read-only view of the stored snapshots, for adapters whose fetch depends on what they last saw.
 */
@FunctionalInterface
public interface SnapshotLookup {
    Optional<JsonNode> lookup(String siteId);
}
