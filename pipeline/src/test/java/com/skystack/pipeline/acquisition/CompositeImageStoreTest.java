package com.skystack.pipeline.acquisition;

import com.skystack.core.model.CelestialLocation;
import com.skystack.pipeline.image.ImageCodec;
import com.skystack.pipeline.image.PixelBuffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CompositeImageStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void namesFilesByRoundedLocation() {
        CompositeImageStore store = new CompositeImageStore(tempDir);

        assertEquals(tempDir.resolve("RA_201.365__DEC_-43.019.jpeg"),
                store.pathFor(new CelestialLocation(201.36512, -43.0189)));
    }

    @Test
    void writesIntoAMissingOutputDirectory() {
        CompositeImageStore store = new CompositeImageStore(tempDir.resolve("out"));

        Path written = store.write(new CelestialLocation(10.0, -5.25), PixelBuffer.gray(8, 6, 90));

        assertEquals(tempDir.resolve("out/RA_10.0__DEC_-5.25.jpeg"), written);
        PixelBuffer decoded = ImageCodec.read(written);
        assertEquals(8, decoded.height());
        assertEquals(6, decoded.width());
    }
}
