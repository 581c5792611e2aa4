package com.skystack.core.bus;

import com.skystack.core.events.AcquisitionAttemptFailed;
import com.skystack.core.events.AcquisitionAttemptStarted;
import com.skystack.core.model.CelestialLocation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final CelestialLocation LOCATION = new CelestialLocation(10.5, -20.25);

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(AcquisitionAttemptStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(AcquisitionAttemptStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new AcquisitionAttemptStarted(Instant.parse("2026-01-01T00:00:00Z"), LOCATION, 0, 1));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger startedHits = new AtomicInteger();
        AtomicInteger failedHits = new AtomicInteger();

        bus.subscribe(AcquisitionAttemptStarted.class, event -> startedHits.incrementAndGet());
        bus.subscribe(AcquisitionAttemptFailed.class, event -> failedHits.incrementAndGet());

        bus.publish(new AcquisitionAttemptStarted(Instant.parse("2026-01-01T00:00:00Z"), LOCATION, 0, 1));
        bus.publish(new AcquisitionAttemptFailed(Instant.parse("2026-01-01T00:00:01Z"), LOCATION, "ABANDON", "QUERYING", "EmptySearch"));

        assertEquals(1, startedHits.get());
        assertEquals(1, failedHits.get());
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(AcquisitionAttemptStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(AcquisitionAttemptStarted.class, event -> safeHits.incrementAndGet());

        bus.publish(new AcquisitionAttemptStarted(Instant.parse("2026-01-01T00:00:00Z"), LOCATION, 0, 1));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }

    @Test
    void handlerSubscribedDuringPublishSeesOnlyLaterEvents() {
        EventBus bus = new EventBus();
        AtomicInteger lateHits = new AtomicInteger();
        bus.subscribe(AcquisitionAttemptStarted.class, event ->
                bus.subscribe(AcquisitionAttemptStarted.class, later -> lateHits.incrementAndGet()));

        bus.publish(new AcquisitionAttemptStarted(Instant.parse("2026-01-01T00:00:00Z"), LOCATION, 0, 1));
        assertEquals(0, lateHits.get());

        bus.publish(new AcquisitionAttemptStarted(Instant.parse("2026-01-01T00:00:01Z"), LOCATION, 0, 2));
        assertEquals(1, lateHits.get());
    }

    @Test
    void eventsWithoutSubscribersAreDropped() {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });

        bus.publish(new AcquisitionAttemptFailed(Instant.parse("2026-01-01T00:00:00Z"), LOCATION, "RETRYABLE", "QUERYING", "timeout"));
    }
}
