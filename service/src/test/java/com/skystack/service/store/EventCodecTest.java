package com.skystack.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.skystack.core.bus.EventBus;
import com.skystack.core.events.AcquisitionAttemptFailed;
import com.skystack.core.events.AcquisitionAttemptStarted;
import com.skystack.core.events.AlertRaised;
import com.skystack.core.events.CompositePersisted;
import com.skystack.core.events.Event;
import com.skystack.core.model.CelestialLocation;
import com.skystack.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class EventCodecTest {
    private static final Instant NOW = Instant.parse("2026-03-01T21:00:00Z");
    private static final CelestialLocation M83 = new CelestialLocation(204.254, -29.866);

    @Test
    void envelopeCarriesTypeTimestampAndPayload() throws Exception {
        String line = EventCodec.toJsonLine(new AcquisitionAttemptFailed(NOW, M83, "ABANDON", "SELECTING", "only 2 exposures"));

        JsonNode node = JsonUtils.objectMapper().readTree(line);
        assertEquals("AcquisitionAttemptFailed", node.path("type").asText());
        assertEquals("2026-03-01T21:00:00Z", node.path("timestamp").asText());
        assertEquals("ABANDON", node.path("event").path("outcome").asText());
        assertEquals("SELECTING", node.path("event").path("state").asText());
        assertEquals(204.254, node.path("event").path("location").path("rightAscension").asDouble(), 1e-9);
        assertEquals(-29.866, node.path("event").path("location").path("declination").asDouble(), 1e-9);
    }

    @Test
    void eachEventIsASingleLine() {
        List<Event> events = List.of(
                new AcquisitionAttemptStarted(NOW, M83, 0, 1),
                new CompositePersisted(NOW, M83, new CelestialLocation(204.25, -29.87), "output/RA_204.25__DEC_-29.87.jpeg", 6, 1200L),
                new AlertRaised(NOW, "acquisition", "Archive rejected\nquery", Map.of("ra", "204.254"))
        );

        for (Event event : events) {
            String line = EventCodec.toJsonLine(event);
            assertFalse(line.contains("\n"), line);
            assertFalse(line.contains("\r"), line);
        }
    }

    @Test
    void alertDetailsAreKept() throws Exception {
        AlertRaised alert = new AlertRaised(NOW, "acquisition", "Archive rejected query", Map.of("ra", "204.254"));

        JsonNode event = JsonUtils.objectMapper().readTree(EventCodec.toJsonLine(alert)).path("event");

        assertEquals("acquisition", event.path("category").asText());
        assertEquals("204.254", event.path("details").path("ra").asText());
    }

    @Test
    void subscribeAllForwardsEveryEventType() {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected event handler error", error);
        });
        List<Event> seen = new ArrayList<>();
        EventCodec.subscribeAll(bus, seen::add);

        bus.publish(new AcquisitionAttemptStarted(NOW, M83, 0, 1));
        bus.publish(new AcquisitionAttemptFailed(NOW, M83, "RETRYABLE", "QUERYING", "timeout"));
        bus.publish(new CompositePersisted(NOW, M83, M83, "out.jpeg", 5, 10L));
        bus.publish(new AlertRaised(NOW, "sweep", "gave up", Map.of()));

        assertEquals(4, seen.size());
    }
}
