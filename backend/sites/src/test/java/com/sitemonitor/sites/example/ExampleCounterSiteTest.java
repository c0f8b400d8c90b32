package com.sitemonitor.sites.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.sitemonitor.core.schedule.IntervalSchedule;
import com.sitemonitor.core.schedule.ScheduleParser;
import com.sitemonitor.core.util.JsonUtils;
import com.sitemonitor.sites.support.SiteContexts;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExampleCounterSiteTest {
    private final ExampleCounterSite site = new ExampleCounterSite();

    @Test
    void firstFetchStartsCountingAtOne() {
        JsonNode payload = site.fetch(SiteContexts.withSnapshots(Map.of())).join();

        assertEquals(1, payload.path("update_count").asInt());
        assertEquals("Example Update #1", payload.path("title").asText());
        assertEquals(SiteContexts.NOW.toString(), payload.path("timestamp").asText());
    }

    @Test
    void fetchContinuesFromStoredSnapshot() throws Exception {
        JsonNode stored = JsonUtils.objectMapper().readTree("{\"update_count\":41}");

        JsonNode payload = site.fetch(SiteContexts.withSnapshots(Map.of(ExampleCounterSite.ID, stored))).join();

        assertEquals(42, payload.path("update_count").asInt());
    }

    @Test
    void compareTreatsFirstObservationAsUpdateAndOnlyHigherCountsAfterwards() throws Exception {
        JsonNode one = JsonUtils.objectMapper().readTree("{\"update_count\":1}");
        JsonNode two = JsonUtils.objectMapper().readTree("{\"update_count\":2}");

        assertTrue(site.compare(null, one));
        assertTrue(site.compare(one, two));
        assertFalse(site.compare(two, two));
        assertFalse(site.compare(two, one));
    }

    @Test
    void formatRendersTitleAndContent() throws Exception {
        JsonNode payload = JsonUtils.objectMapper().readTree("{\"title\":\"Example Update #3\",\"content\":\"body\"}");

        assertEquals("【Example site update】\nExample Update #3\nbody", site.format(payload));
    }

    @Test
    void defaultScheduleIsATenSecondInterval() {
        IntervalSchedule schedule = assertInstanceOf(IntervalSchedule.class, ScheduleParser.parse(site.schedule()));

        assertEquals(Duration.ofSeconds(10), schedule.period());
    }
}
