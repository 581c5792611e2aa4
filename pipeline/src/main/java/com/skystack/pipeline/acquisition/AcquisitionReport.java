package com.skystack.pipeline.acquisition;

import com.skystack.core.model.VisitedLocations;

import java.nio.file.Path;
import java.util.List;

public record AcquisitionReport(
        List<Path> images,
        VisitedLocations visited,
        int attempts,
        int retries,
        int abandoned
) {
    public AcquisitionReport {
        images = List.copyOf(images);
    }
}
