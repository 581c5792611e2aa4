package com.skystack.pipeline.api;

import com.skystack.pipeline.image.PixelBuffer;

import java.nio.file.Path;
import java.util.List;

@FunctionalInterface
public interface ExposureStacker {
    PixelBuffer stack(List<Path> exposures);
}
