package com.skystack.pipeline.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record AcquisitionConfig(
        AcquisitionMode mode,
        Integer imageCount,
        String outputDir,
        String scratchDir,
        Double searchRadiusDegrees,
        String productType,
        String instrument,
        List<String> spectralElements,
        Double autoscale,
        Integer asinh,
        Integer minExposures,
        Integer whiteLevel,
        Duration retryDelay,
        Integer sweepMaxRetries,
        Duration connectTimeout,
        Duration requestTimeout,
        Long seed
) {
    public static final double DEFAULT_SEARCH_RADIUS = 0.4;
    public static final String DEFAULT_INSTRUMENT = "WFC3";
    public static final int DEFAULT_MIN_EXPOSURES = 5;
    public static final int DEFAULT_WHITE_LEVEL = 255;

    public AcquisitionConfig {
        if (mode == null) {
            mode = AcquisitionMode.STACKED;
        }
        if (imageCount == null) {
            imageCount = 1;
        }
        if (imageCount < 0) {
            throw new IllegalArgumentException("imageCount must not be negative: " + imageCount);
        }
        if (outputDir == null || outputDir.isBlank()) {
            outputDir = "output";
        }
        if (scratchDir == null || scratchDir.isBlank()) {
            scratchDir = outputDir;
        }
        if (searchRadiusDegrees == null) {
            searchRadiusDegrees = DEFAULT_SEARCH_RADIUS;
        }
        if (productType == null || productType.isBlank()) {
            productType = switch (mode) {
                case STACKED -> "exposure";
                case PREPROCESSED -> "combined";
                case ALL_SKY -> "HLSP";
            };
        }
        if (instrument == null || instrument.isBlank()) {
            instrument = DEFAULT_INSTRUMENT;
        }
        spectralElements = spectralElements == null ? List.of() : List.copyOf(spectralElements);
        if (autoscale == null) {
            autoscale = 99.5;
        }
        if (asinh == null) {
            asinh = 1;
        }
        if (minExposures == null) {
            minExposures = DEFAULT_MIN_EXPOSURES;
        }
        if (minExposures < 1) {
            throw new IllegalArgumentException("minExposures must be at least 1: " + minExposures);
        }
        if (whiteLevel == null) {
            whiteLevel = DEFAULT_WHITE_LEVEL;
        }
        if (whiteLevel < 1 || whiteLevel > 255) {
            throw new IllegalArgumentException("whiteLevel must be in [1, 255]: " + whiteLevel);
        }
        if (retryDelay == null) {
            retryDelay = Duration.ZERO;
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
        }
        if (sweepMaxRetries == null) {
            sweepMaxRetries = 0;
        }
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(5);
        }
        if (requestTimeout == null) {
            requestTimeout = Duration.ofSeconds(30);
        }
    }

    public static AcquisitionConfig defaults() {
        return new AcquisitionConfig(null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }

    public static AcquisitionConfig of(AcquisitionMode mode, Path outputDir) {
        return new AcquisitionConfig(mode, null, outputDir.toString(), null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }

    public Path outputPath() {
        return Path.of(outputDir);
    }

    public Path scratchPath() {
        return Path.of(scratchDir);
    }

    public AcquisitionConfig withMinExposures(int value) {
        return new AcquisitionConfig(mode, imageCount, outputDir, scratchDir, searchRadiusDegrees, productType,
                instrument, spectralElements, autoscale, asinh, value, whiteLevel, retryDelay, sweepMaxRetries,
                connectTimeout, requestTimeout, seed);
    }

    public AcquisitionConfig withRetryDelay(Duration value) {
        return new AcquisitionConfig(mode, imageCount, outputDir, scratchDir, searchRadiusDegrees, productType,
                instrument, spectralElements, autoscale, asinh, minExposures, whiteLevel, value, sweepMaxRetries,
                connectTimeout, requestTimeout, seed);
    }

    public AcquisitionConfig withSweepMaxRetries(int value) {
        return new AcquisitionConfig(mode, imageCount, outputDir, scratchDir, searchRadiusDegrees, productType,
                instrument, spectralElements, autoscale, asinh, minExposures, whiteLevel, retryDelay, value,
                connectTimeout, requestTimeout, seed);
    }
}
