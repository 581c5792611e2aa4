package com.skystack.core.events;

import com.skystack.core.model.CelestialLocation;

import java.time.Instant;

public record AcquisitionAttemptStarted(
        Instant timestamp,
        CelestialLocation location,
        int imageIndex,
        int attempt
) implements Event {
    @Override
    public String type() {
        return "AcquisitionAttemptStarted";
    }
}
