package com.skystack.pipeline.sampling;

import com.skystack.core.model.CelestialLocation;
import com.skystack.core.model.VisitedLocations;

import java.util.Objects;
import java.util.Random;

public final class LocationSampler {
    private final Random random;

    public LocationSampler(Random random) {
        this.random = Objects.requireNonNull(random, "random is required");
    }

    public CelestialLocation next(VisitedLocations visited) {
        while (true) {
            CelestialLocation candidate = draw();
            if (!visited.contains(candidate)) {
                return candidate;
            }
        }
    }

    CelestialLocation draw() {
        double rightAscension = random.nextDouble() * 360.0;
        // uniform in sin(dec) gives equal density per unit solid angle
        double declination = Math.toDegrees(Math.asin(random.nextDouble() * 2.0 - 1.0));
        return CelestialLocation.rounded(rightAscension, declination);
    }
}
