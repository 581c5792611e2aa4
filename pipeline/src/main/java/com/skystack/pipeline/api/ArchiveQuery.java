package com.skystack.pipeline.api;

import com.skystack.core.model.CelestialLocation;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public record ArchiveQuery(
        CelestialLocation center,
        double radiusDegrees,
        String productType,
        String instrument,
        List<String> spectralElements,
        double autoscale,
        int asinh
) {
    public static final double ALL_SKY_RADIUS = 180.0;
    public static final double DEFAULT_AUTOSCALE = 99.5;
    public static final int DEFAULT_ASINH = 1;

    private static final Set<String> PRODUCT_TYPES = Set.of(
            "best", "exposure", "combined", "mosaic", "color", "hlsp", "all"
    );

    public ArchiveQuery {
        if (center == null) {
            throw new InvalidQueryException("center is required");
        }
        if (Double.isNaN(radiusDegrees) || radiusDegrees <= 0.0 || radiusDegrees > ALL_SKY_RADIUS) {
            throw new InvalidQueryException("radiusDegrees must be in (0, 180]: " + radiusDegrees);
        }
        if (productType == null || !PRODUCT_TYPES.contains(productType.toLowerCase(Locale.ROOT))) {
            throw new InvalidQueryException("Unsupported product type: " + productType);
        }
        if (instrument == null || instrument.isBlank()) {
            throw new InvalidQueryException("instrument is required");
        }
        if (Double.isNaN(autoscale) || autoscale <= 0.0 || autoscale > 100.0) {
            throw new InvalidQueryException("autoscale must be in (0, 100]: " + autoscale);
        }
        if (asinh < 0) {
            throw new InvalidQueryException("asinh must not be negative: " + asinh);
        }
        spectralElements = spectralElements == null
                ? List.of()
                : spectralElements.stream().filter(Objects::nonNull).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    public static ArchiveQuery of(CelestialLocation center, double radiusDegrees, String productType, String instrument) {
        return new ArchiveQuery(center, radiusDegrees, productType, instrument, List.of(), DEFAULT_AUTOSCALE, DEFAULT_ASINH);
    }

    public static ArchiveQuery allSky(String productType, String instrument) {
        return of(new CelestialLocation(0.0, 0.0), ALL_SKY_RADIUS, productType, instrument);
    }
}
