package com.skystack.core.model;

import java.net.URI;
import java.util.Objects;

public record ExposureRecord(CelestialLocation location, URI sourceUrl, String instrument) {
    public ExposureRecord {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(sourceUrl, "sourceUrl is required");
        instrument = instrument == null ? "" : instrument;
    }
}
