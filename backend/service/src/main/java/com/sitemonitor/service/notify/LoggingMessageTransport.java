package com.sitemonitor.service.notify;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Writes notifications to the log instead of a chat service. Ids must be numeric; when a set of
 * known groups is given, any other id is refused as a group target.
 */
public class LoggingMessageTransport implements MessageTransport {
    private static final Logger LOGGER = Logger.getLogger(LoggingMessageTransport.class.getName());

    private final Set<String> knownGroups;

    public LoggingMessageTransport() {
        this(Set.of());
    }

    public LoggingMessageTransport(Set<String> knownGroups) {
        this.knownGroups = Set.copyOf(knownGroups);
    }

    @Override
    public CompletableFuture<Void> sendGroupMessage(String groupId, String text) {
        if (!isNumeric(groupId) || (!knownGroups.isEmpty() && !knownGroups.contains(groupId))) {
            return CompletableFuture.failedFuture(DeliveryException.invalidTarget("Not a group: " + groupId));
        }
        LOGGER.info("[group " + groupId + "] " + text);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> sendIndividualMessage(String userId, String text) {
        if (!isNumeric(userId)) {
            return CompletableFuture.failedFuture(DeliveryException.invalidTarget("Not a user: " + userId));
        }
        LOGGER.info("[user " + userId + "] " + text);
        return CompletableFuture.completedFuture(null);
    }

    static boolean isNumeric(String id) {
        return id != null && !id.isEmpty() && id.chars().allMatch(Character::isDigit);
    }
}
