package com.skystack.pipeline.acquisition;

import com.skystack.core.model.CelestialLocation;
import com.skystack.pipeline.image.ImageCodec;
import com.skystack.pipeline.image.PixelBuffer;

import java.nio.file.Path;

public final class CompositeImageStore {
    public static final String EXTENSION = ".jpeg";

    private final Path outputDir;

    public CompositeImageStore(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path pathFor(CelestialLocation location) {
        return outputDir.resolve(location.fileKey() + EXTENSION);
    }

    public Path write(CelestialLocation location, PixelBuffer image) {
        Path target = pathFor(location);
        ImageCodec.write(image, target);
        return target;
    }
}
