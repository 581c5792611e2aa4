package com.skystack.core.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public final class VisitedLocations {
    private static final VisitedLocations EMPTY = new VisitedLocations(Set.of());

    private final Set<CelestialLocation> locations;

    private VisitedLocations(Set<CelestialLocation> locations) {
        this.locations = locations;
    }

    public static VisitedLocations empty() {
        return EMPTY;
    }

    public boolean contains(CelestialLocation location) {
        return locations.contains(location);
    }

    public VisitedLocations with(CelestialLocation location) {
        Objects.requireNonNull(location, "location is required");
        if (locations.contains(location)) {
            return this;
        }
        Set<CelestialLocation> next = new HashSet<>(locations);
        next.add(location);
        return new VisitedLocations(Collections.unmodifiableSet(next));
    }

    public int size() {
        return locations.size();
    }
}
