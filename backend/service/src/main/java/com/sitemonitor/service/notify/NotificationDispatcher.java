package com.sitemonitor.service.notify;

import com.sitemonitor.core.bus.EventBus;
import com.sitemonitor.core.events.NotificationFailed;
import com.sitemonitor.core.events.NotificationSent;
import com.sitemonitor.core.model.RecipientKind;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Best-effort fan-out of one message. Each recipient is tried as a group first and, only when the
 * transport says the id is not a valid group, as an individual. A failure for one recipient is
 * logged and recorded; it never stops delivery to the rest.
 */
public class NotificationDispatcher {
    private static final Logger LOGGER = Logger.getLogger(NotificationDispatcher.class.getName());

    private final MessageTransport transport;
    private final EventBus eventBus;
    private final Clock clock;

    public NotificationDispatcher(MessageTransport transport, EventBus eventBus, Clock clock) {
        this.transport = transport;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public DeliveryReport dispatch(String siteId, String text, List<String> recipients) {
        List<DeliveryReport.Delivery> deliveries = new ArrayList<>(recipients.size());
        for (String recipient : recipients) {
            DeliveryReport.Delivery delivery = deliver(siteId, text, recipient);
            deliveries.add(delivery);
            if (delivery.outcome() == DeliveryOutcome.FAILED) {
                eventBus.publish(new NotificationFailed(clock.instant(), siteId, recipient, delivery.error()));
            } else {
                RecipientKind kind = delivery.outcome() == DeliveryOutcome.GROUP ? RecipientKind.GROUP : RecipientKind.INDIVIDUAL;
                eventBus.publish(new NotificationSent(clock.instant(), siteId, recipient, kind));
            }
        }
        return new DeliveryReport(deliveries);
    }

    private DeliveryReport.Delivery deliver(String siteId, String text, String recipient) {
        try {
            await(transport.sendGroupMessage(recipient, text));
            LOGGER.fine("Sent " + siteId + " notification to group " + recipient);
            return new DeliveryReport.Delivery(recipient, DeliveryOutcome.GROUP, null);
        } catch (DeliveryException e) {
            if (!e.invalidTarget()) {
                return failure(siteId, recipient, e);
            }
        } catch (RuntimeException e) {
            return failure(siteId, recipient, e);
        }

        try {
            await(transport.sendIndividualMessage(recipient, text));
            LOGGER.fine("Sent " + siteId + " notification to user " + recipient);
            return new DeliveryReport.Delivery(recipient, DeliveryOutcome.INDIVIDUAL, null);
        } catch (RuntimeException e) {
            return failure(siteId, recipient, e);
        }
    }

    private DeliveryReport.Delivery failure(String siteId, String recipient, Exception error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        LOGGER.log(Level.WARNING, "Failed sending " + siteId + " notification to " + recipient + ": " + message, error);
        return new DeliveryReport.Delivery(recipient, DeliveryOutcome.FAILED, message);
    }

    private static void await(CompletableFuture<Void> pending) {
        if (pending == null) {
            throw DeliveryException.failed("transport returned no result");
        }
        try {
            pending.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw DeliveryException.failed(String.valueOf(cause.getMessage()), cause);
        }
    }
}
