package com.sitemonitor.service.store;

import com.sitemonitor.core.events.AlertRaised;
import com.sitemonitor.core.events.ContentChanged;
import com.sitemonitor.core.events.Event;
import com.sitemonitor.core.events.NotificationFailed;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    private static final Instant AT = Instant.parse("2026-02-12T20:00:00Z");

    @Test
    void lineCarriesTypeAndTimestampEnvelope() {
        String line = EventCodec.toJsonLine(new ContentChanged(AT, "demo", true, 2));

        assertTrue(line.contains("\"type\":\"ContentChanged\""));
        assertTrue(line.contains("\"timestamp\":\"2026-02-12T20:00:00Z\""));
        assertEquals(new ContentChanged(AT, "demo", true, 2), EventCodec.fromJsonLine(line));
    }

    @Test
    void nullFieldsAreOmittedAndDecodeAsNull() {
        String line = EventCodec.toJsonLine(new NotificationFailed(AT, "demo", "1001", null));
        Event decoded = EventCodec.fromJsonLine(line);

        assertEquals(new NotificationFailed(AT, "demo", "1001", null), decoded);
    }

    @Test
    void alertDetailsSurvive() {
        AlertRaised alert = new AlertRaised(AT, "fetch", "Fetch failed", Map.of("siteId", "demo"));
        AlertRaised decoded = (AlertRaised) EventCodec.fromJsonLine(EventCodec.toJsonLine(alert));

        assertEquals("demo", decoded.details().get("siteId"));
    }

    @Test
    void unknownTypeIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                EventCodec.fromJsonLine("{\"type\":\"NewsUpdated\",\"event\":{}}"));
        assertTrue(ex.getMessage().contains("NewsUpdated"));
    }

    @Test
    void malformedLineIsRejected() {
        assertThrows(IllegalStateException.class, () -> EventCodec.fromJsonLine("{nope"));
    }
}
