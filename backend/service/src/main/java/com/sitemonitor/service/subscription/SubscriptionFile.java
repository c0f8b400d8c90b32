package com.sitemonitor.service.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitemonitor.core.util.JsonUtils;
import com.sitemonitor.service.store.AtomicJsonFiles;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * On-disk form of the registry: one JSON object keyed by site id, each value
 * {@code {"users": [...], "groups": [...]}}. The recipient-keyed layout
 * ({@code {"<recipient>": ["site", ...]}}) is refused because it cannot tell users from groups.
 */
final class SubscriptionFile {
    private static final Logger LOGGER = Logger.getLogger(SubscriptionFile.class.getName());

    private final Path file;

    SubscriptionFile(Path file) {
        this.file = file;
    }

    Path path() {
        return file;
    }

    boolean exists() {
        return Files.exists(file);
    }

    Map<String, SiteSubscribers> read() {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = JsonUtils.objectMapper().readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading subscriptions from " + file, e);
        }
        if (root == null || root.isMissingNode()) {
            throw new IllegalStateException("Failed loading subscriptions from " + file + ": file is empty");
        }
        if (!root.isObject()) {
            throw new IllegalStateException("Failed loading subscriptions from " + file + ": expected a JSON object");
        }

        Map<String, SiteSubscribers> loaded = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value.isArray()) {
                throw new IllegalStateException("Failed loading subscriptions from " + file
                        + ": entry '" + entry.getKey() + "' uses the recipient-keyed layout;"
                        + " expected {\"<site>\": {\"users\": [...], \"groups\": [...]}}");
            }
            if (!value.isObject()) {
                throw new IllegalStateException("Failed loading subscriptions from " + file
                        + ": entry '" + entry.getKey() + "' is not an object");
            }
            loaded.put(entry.getKey(), new SiteSubscribers(
                    recipients(entry.getKey(), "users", value.path("users")),
                    recipients(entry.getKey(), "groups", value.path("groups"))
            ));
        }
        return loaded;
    }

    void write(Map<String, SiteSubscribers> subscriptions) {
        ObjectNode root = JsonUtils.objectMapper().createObjectNode();
        subscriptions.forEach((siteId, subscribers) -> {
            ObjectNode entry = root.putObject(siteId);
            ArrayNode users = entry.putArray("users");
            subscribers.users().forEach(users::add);
            ArrayNode groups = entry.putArray("groups");
            subscribers.groups().forEach(groups::add);
        });

        try {
            AtomicJsonFiles.write(file, root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing subscriptions to " + file, e);
        }
    }

    private List<String> recipients(String siteId, String kind, JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalStateException("Failed loading subscriptions from " + file
                    + ": '" + siteId + "." + kind + "' is not an array");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (JsonNode recipient : node) {
            if (!unique.add(recipient.asText())) {
                LOGGER.warning("Dropping duplicate " + kind + " entry " + recipient.asText() + " for site " + siteId);
            }
        }
        return new ArrayList<>(unique);
    }
}
