package com.skystack.core.events;

import com.skystack.core.model.CelestialLocation;

import java.time.Instant;

public record AcquisitionAttemptFailed(
        Instant timestamp,
        CelestialLocation location,
        String outcome,
        String state,
        String reason
) implements Event {
    @Override
    public String type() {
        return "AcquisitionAttemptFailed";
    }
}
