package com.sitemonitor.service.notify;

import java.util.concurrent.CompletableFuture;

/**
 * Delivers rendered text to a chat target. A future failed with a {@link DeliveryException} whose
 * {@link DeliveryException#invalidTarget()} is true means the id is not a target of that kind.
 */
public interface MessageTransport {
    CompletableFuture<Void> sendGroupMessage(String groupId, String text);

    CompletableFuture<Void> sendIndividualMessage(String userId, String text);
}
