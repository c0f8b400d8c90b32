package com.sitemonitor.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitemonitor.core.events.AlertRaised;
import com.sitemonitor.core.events.ContentChanged;
import com.sitemonitor.core.events.Event;
import com.sitemonitor.core.events.NotificationFailed;
import com.sitemonitor.core.events.NotificationSent;
import com.sitemonitor.core.events.PollCycleCompleted;
import com.sitemonitor.core.events.PollCycleStarted;
import com.sitemonitor.core.events.SiteFetched;
import com.sitemonitor.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Journal line format: {@code {"type": ..., "timestamp": ..., "event": {...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "PollCycleStarted", PollCycleStarted.class,
            "SiteFetched", SiteFetched.class,
            "ContentChanged", ContentChanged.class,
            "NotificationSent", NotificationSent.class,
            "NotificationFailed", NotificationFailed.class,
            "PollCycleCompleted", PollCycleCompleted.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
