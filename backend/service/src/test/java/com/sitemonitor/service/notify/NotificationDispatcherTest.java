package com.sitemonitor.service.notify;

import com.sitemonitor.core.bus.EventBus;
import com.sitemonitor.core.events.NotificationFailed;
import com.sitemonitor.core.events.NotificationSent;
import com.sitemonitor.core.model.RecipientKind;
import com.sitemonitor.service.support.EventCapture;
import com.sitemonitor.service.support.RecordingTransport;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationDispatcherTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-12T20:00:00Z"), ZoneOffset.UTC);

    @Test
    void invalidRecipientDoesNotBlockOthers() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        RecordingTransport transport = new RecordingTransport().withGroups("1001").withUsers("2002");
        NotificationDispatcher dispatcher = new NotificationDispatcher(transport, bus, CLOCK);

        DeliveryReport report = dispatcher.dispatch("demo", "hello", List.of("1001", "bogus", "2002"));

        assertEquals(List.of(
                new DeliveryReport.Delivery("1001", DeliveryOutcome.GROUP, null),
                report.deliveries().get(1),
                new DeliveryReport.Delivery("2002", DeliveryOutcome.INDIVIDUAL, null)
        ), report.deliveries());
        assertEquals(DeliveryOutcome.FAILED, report.deliveries().get(1).outcome());
        assertNotNull(report.deliveries().get(1).error());
        assertEquals(2, report.delivered());
        assertEquals(1, report.failed());

        assertEquals(2, transport.sent().size());
        assertEquals(2, capture.byType(NotificationSent.class).size());
        assertEquals("bogus", capture.byType(NotificationFailed.class).get(0).recipient());
    }

    @Test
    void groupIsTriedBeforeIndividual() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        RecordingTransport transport = new RecordingTransport().withGroups("777").withUsers("777");

        DeliveryReport report = new NotificationDispatcher(transport, bus, CLOCK).dispatch("demo", "hi", List.of("777"));

        assertEquals(DeliveryOutcome.GROUP, report.deliveries().get(0).outcome());
        assertEquals(1, transport.sent().size());
        assertTrue(transport.sent().get(0).group());
        assertEquals(RecipientKind.GROUP, capture.byType(NotificationSent.class).get(0).kind());
    }

    @Test
    void transportFailureOnGroupDoesNotFallBackToIndividual() {
        RecordingTransport transport = new RecordingTransport().withUsers("5").failingFor("5");

        DeliveryReport report = new NotificationDispatcher(transport, new EventBus(), CLOCK)
                .dispatch("demo", "hi", List.of("5"));

        assertEquals(DeliveryOutcome.FAILED, report.deliveries().get(0).outcome());
        assertEquals("connection reset", report.deliveries().get(0).error());
        assertTrue(transport.sent().isEmpty());
    }

    @Test
    void throwingTransportIsContainedPerRecipient() {
        MessageTransport transport = new MessageTransport() {
            @Override
            public CompletableFuture<Void> sendGroupMessage(String groupId, String text) {
                if ("explode".equals(groupId)) {
                    throw new IllegalStateException("boom");
                }
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public CompletableFuture<Void> sendIndividualMessage(String userId, String text) {
                return CompletableFuture.completedFuture(null);
            }
        };

        DeliveryReport report = new NotificationDispatcher(transport, new EventBus(), CLOCK)
                .dispatch("demo", "hi", List.of("explode", "1"));

        assertEquals(DeliveryOutcome.FAILED, report.deliveries().get(0).outcome());
        assertEquals("boom", report.deliveries().get(0).error());
        assertEquals(DeliveryOutcome.GROUP, report.deliveries().get(1).outcome());
    }

    @Test
    void noRecipientsMeansEmptyReport() {
        RecordingTransport transport = new RecordingTransport();
        DeliveryReport report = new NotificationDispatcher(transport, new EventBus(), CLOCK).dispatch("demo", "hi", List.of());
        assertTrue(report.deliveries().isEmpty());
        assertTrue(transport.sent().isEmpty());
    }
}
