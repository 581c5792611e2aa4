package com.skystack.core.model;

import java.net.URI;
import java.util.List;
import java.util.Objects;

public record ExposureGroup(CelestialLocation location, List<URI> urls) {
    public ExposureGroup {
        Objects.requireNonNull(location, "location is required");
        urls = List.copyOf(urls);
    }

    public int size() {
        return urls.size();
    }
}
