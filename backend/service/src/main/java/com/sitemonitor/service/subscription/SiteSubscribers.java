package com.sitemonitor.service.subscription;

import java.util.ArrayList;
import java.util.List;

/**
 * Recipients of one site's notifications, split by how they are addressed. Each list holds a
 * recipient at most once.
 */
public record SiteSubscribers(List<String> users, List<String> groups) {
    public SiteSubscribers {
        users = users == null ? List.of() : List.copyOf(users);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static SiteSubscribers empty() {
        return new SiteSubscribers(List.of(), List.of());
    }

    public boolean isEmpty() {
        return users.isEmpty() && groups.isEmpty();
    }

    public List<String> of(boolean isGroup) {
        return isGroup ? groups : users;
    }

    SiteSubscribers with(String recipient, boolean isGroup) {
        List<String> updated = new ArrayList<>(of(isGroup));
        updated.add(recipient);
        return isGroup ? new SiteSubscribers(users, updated) : new SiteSubscribers(updated, groups);
    }

    SiteSubscribers without(String recipient, boolean isGroup) {
        List<String> updated = new ArrayList<>(of(isGroup));
        updated.remove(recipient);
        return isGroup ? new SiteSubscribers(users, updated) : new SiteSubscribers(updated, groups);
    }
}
