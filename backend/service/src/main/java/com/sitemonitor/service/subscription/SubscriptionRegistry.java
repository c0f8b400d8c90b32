package com.sitemonitor.service.subscription;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Who gets notified for which site.
 *
 * <p>Callers name the standing subscription to every site with the all-sites token
 * ({@value #DEFAULT_ALL_TOKEN} unless configured otherwise); it is stored under the reserved id
 * {@value #ALL_SITES_ID}, which never leaves this class. Every mutation is written to disk before
 * it becomes visible: if the write fails the call throws and the in-memory state is unchanged.
 * All reads and writes are serialized on one lock.
 */
public class SubscriptionRegistry {
    private static final Logger LOGGER = Logger.getLogger(SubscriptionRegistry.class.getName());

    public static final String ALL_SITES_ID = "all";
    public static final String DEFAULT_ALL_TOKEN = "全部";
    public static final String DEFAULT_FILE_NAME = "subscriptions.json";

    private final SubscriptionFile file;
    private final String allToken;
    private final ReentrantLock lock = new ReentrantLock();
    private Map<String, SiteSubscribers> subscriptions;

    public SubscriptionRegistry(Path file) {
        this(file, DEFAULT_ALL_TOKEN);
    }

    public SubscriptionRegistry(Path file, String allToken) {
        if (allToken == null || allToken.isBlank() || ALL_SITES_ID.equals(allToken)) {
            throw new IllegalArgumentException("all-sites token must be non-blank and differ from '" + ALL_SITES_ID + "'");
        }
        this.file = new SubscriptionFile(file);
        this.allToken = allToken;
        this.subscriptions = load();
    }

    public String allToken() {
        return allToken;
    }

    public boolean isAllToken(String siteName) {
        return allToken.equals(siteName);
    }

    /**
     * @return false when the recipient was already subscribed; nothing is written in that case
     * @throws IllegalStateException when the updated registry could not be persisted
     */
    public boolean subscribe(String recipient, String siteIdOrAllToken, boolean isGroup) {
        Objects.requireNonNull(recipient, "recipient is required");
        String siteId = toInternal(siteIdOrAllToken);
        lock.lock();
        try {
            SiteSubscribers current = subscriptions.getOrDefault(siteId, SiteSubscribers.empty());
            if (current.of(isGroup).contains(recipient)) {
                LOGGER.info(kind(isGroup) + " " + recipient + " is already subscribed to " + siteIdOrAllToken);
                return false;
            }
            Map<String, SiteSubscribers> updated = new LinkedHashMap<>(subscriptions);
            updated.put(siteId, current.with(recipient, isGroup));
            commit(updated);
            LOGGER.info(kind(isGroup) + " " + recipient + " subscribed to " + siteIdOrAllToken);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false when the recipient was not subscribed; nothing is written in that case
     * @throws IllegalStateException when the updated registry could not be persisted
     */
    public boolean unsubscribe(String recipient, String siteIdOrAllToken, boolean isGroup) {
        Objects.requireNonNull(recipient, "recipient is required");
        String siteId = toInternal(siteIdOrAllToken);
        lock.lock();
        try {
            SiteSubscribers current = subscriptions.get(siteId);
            if (current == null || !current.of(isGroup).contains(recipient)) {
                LOGGER.info(kind(isGroup) + " " + recipient + " is not subscribed to " + siteIdOrAllToken);
                return false;
            }
            SiteSubscribers remaining = current.without(recipient, isGroup);
            Map<String, SiteSubscribers> updated = new LinkedHashMap<>(subscriptions);
            if (remaining.isEmpty() && !ALL_SITES_ID.equals(siteId)) {
                updated.remove(siteId);
            } else {
                updated.put(siteId, remaining);
            }
            commit(updated);
            LOGGER.info(kind(isGroup) + " " + recipient + " unsubscribed from " + siteIdOrAllToken);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sites the recipient is subscribed to, the all-sites subscription reported as the token.
     */
    public Set<String> subscriptionsOf(String recipient, boolean isGroup) {
        lock.lock();
        try {
            Set<String> result = new LinkedHashSet<>();
            subscriptions.forEach((siteId, subscribers) -> {
                if (subscribers.of(isGroup).contains(recipient)) {
                    result.add(toExternal(siteId));
                }
            });
            return Collections.unmodifiableSet(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Direct subscribers of the site (users, then groups) followed by the all-sites subscribers.
     * A recipient subscribed both ways appears twice.
     */
    public List<String> subscribersOf(String siteId) {
        lock.lock();
        try {
            List<String> result = new ArrayList<>();
            if (!ALL_SITES_ID.equals(siteId)) {
                SiteSubscribers direct = subscriptions.get(siteId);
                if (direct != null) {
                    result.addAll(direct.users());
                    result.addAll(direct.groups());
                }
            }
            SiteSubscribers everything = subscriptions.get(ALL_SITES_ID);
            result.addAll(everything.users());
            result.addAll(everything.groups());
            return List.copyOf(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of every record, keyed by internal site id.
     */
    public Map<String, SiteSubscribers> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(subscriptions));
        } finally {
            lock.unlock();
        }
    }

    private Map<String, SiteSubscribers> load() {
        if (!file.exists()) {
            Map<String, SiteSubscribers> fresh = new LinkedHashMap<>();
            fresh.put(ALL_SITES_ID, SiteSubscribers.empty());
            file.write(fresh);
            LOGGER.info("Created subscription file " + file.path());
            return fresh;
        }
        Map<String, SiteSubscribers> loaded = file.read();
        loaded.putIfAbsent(ALL_SITES_ID, SiteSubscribers.empty());
        loaded.entrySet().removeIf(entry -> !ALL_SITES_ID.equals(entry.getKey()) && entry.getValue().isEmpty());
        int total = loaded.values().stream().mapToInt(s -> s.users().size() + s.groups().size()).sum();
        LOGGER.info("Loaded " + loaded.size() + " subscription records with " + total + " subscriptions from " + file.path());
        return loaded;
    }

    private void commit(Map<String, SiteSubscribers> updated) {
        file.write(updated);
        subscriptions = updated;
    }

    private String toInternal(String siteIdOrAllToken) {
        if (siteIdOrAllToken == null || siteIdOrAllToken.isBlank()) {
            throw new IllegalArgumentException("site is required");
        }
        if (ALL_SITES_ID.equals(siteIdOrAllToken)) {
            throw new IllegalArgumentException("'" + ALL_SITES_ID + "' is reserved; use '" + allToken + "'");
        }
        return isAllToken(siteIdOrAllToken) ? ALL_SITES_ID : siteIdOrAllToken;
    }

    private String toExternal(String siteId) {
        return ALL_SITES_ID.equals(siteId) ? allToken : siteId;
    }

    private static String kind(boolean isGroup) {
        return isGroup ? "Group" : "User";
    }
}
