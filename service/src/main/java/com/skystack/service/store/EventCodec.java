package com.skystack.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skystack.core.bus.EventBus;
import com.skystack.core.events.AcquisitionAttemptFailed;
import com.skystack.core.events.AcquisitionAttemptStarted;
import com.skystack.core.events.AlertRaised;
import com.skystack.core.events.CompositePersisted;
import com.skystack.core.events.Event;
import com.skystack.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.function.Consumer;

// {"type":..., "timestamp":..., "event":{...}}
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private EventCodec() {
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribe(AcquisitionAttemptStarted.class, consumer::accept);
        bus.subscribe(AcquisitionAttemptFailed.class, consumer::accept);
        bus.subscribe(CompositePersisted.class, consumer::accept);
        bus.subscribe(AlertRaised.class, consumer::accept);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
