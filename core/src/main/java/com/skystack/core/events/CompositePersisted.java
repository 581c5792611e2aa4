package com.skystack.core.events;

import com.skystack.core.model.CelestialLocation;

import java.time.Instant;

public record CompositePersisted(
        Instant timestamp,
        CelestialLocation sampledLocation,
        CelestialLocation imageLocation,
        String path,
        int exposureCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CompositePersisted";
    }
}
