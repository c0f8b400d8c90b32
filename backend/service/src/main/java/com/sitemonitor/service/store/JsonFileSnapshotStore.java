package com.sitemonitor.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitemonitor.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One JSON document per site under the cache directory, named {@code <siteId>_subscription.json}.
 * An unreadable file loads as absent, so the site's next fetch counts as a first observation.
 */
public class JsonFileSnapshotStore implements SnapshotStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileSnapshotStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    static final String FILE_SUFFIX = "_subscription.json";

    private final Path cacheDir;

    public JsonFileSnapshotStore(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    @Override
    public Optional<JsonNode> load(String siteId) {
        Path file = fileFor(siteId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode node = MAPPER.readTree(in);
            if (node == null || node.isMissingNode()) {
                LOGGER.warning("Snapshot file for site " + siteId + " is empty; treating as first observation");
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed loading snapshot for site " + siteId + " from " + file
                    + "; treating as first observation", e);
            return Optional.empty();
        }
    }

    @Override
    public void save(String siteId, JsonNode payload) {
        Path file = fileFor(siteId);
        try {
            AtomicJsonFiles.write(file, payload);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing snapshot for site " + siteId + " to " + file, e);
        }
    }

    Path fileFor(String siteId) {
        return cacheDir.resolve(siteId + FILE_SUFFIX);
    }
}
