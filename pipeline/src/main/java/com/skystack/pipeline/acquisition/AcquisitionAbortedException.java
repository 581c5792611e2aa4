package com.skystack.pipeline.acquisition;

import com.skystack.core.model.CelestialLocation;

public class AcquisitionAbortedException extends RuntimeException {
    private final CelestialLocation location;
    private final int completedImages;

    public AcquisitionAbortedException(String message, CelestialLocation location, int completedImages, Throwable cause) {
        super(message, cause);
        this.location = location;
        this.completedImages = completedImages;
    }

    public CelestialLocation location() {
        return location;
    }

    public int completedImages() {
        return completedImages;
    }
}
