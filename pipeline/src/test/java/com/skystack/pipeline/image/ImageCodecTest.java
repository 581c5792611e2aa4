package com.skystack.pipeline.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageCodecTest {
    @TempDir
    Path tempDir;

    @Test
    void pngKeepsGrayscaleSamplesExactly() {
        PixelBuffer buffer = PixelBuffer.ofRows(new int[][]{{0, 64, 128}, {191, 254, 255}});
        Path file = tempDir.resolve("nested/frame.png");

        ImageCodec.write(buffer, file);

        assertTrue(Files.exists(file));
        assertEquals(buffer, ImageCodec.read(file));
    }

    @Test
    void jpegWriteProducesDecodableImageOfSameSize() {
        Path file = tempDir.resolve("frame.jpeg");

        ImageCodec.write(PixelBuffer.gray(12, 20, 128), file);
        PixelBuffer decoded = ImageCodec.read(file);

        assertEquals(12, decoded.height());
        assertEquals(20, decoded.width());
        assertTrue(Math.abs(decoded.get(6, 10) - 128) <= 2);
    }

    @Test
    void undecodableContentIsAProcessingFailure() throws Exception {
        Path file = tempDir.resolve("exposure_0.jpeg");
        Files.writeString(file, "<html>Service unavailable</html>");

        assertThrows(ImageProcessingException.class, () -> ImageCodec.read(file));
    }

    @Test
    void sixteenBitExposuresAreRejected() throws Exception {
        BufferedImage deep = new BufferedImage(4, 3, BufferedImage.TYPE_USHORT_GRAY);
        deep.getRaster().setSample(1, 1, 0, 40000);
        Path file = tempDir.resolve("deep.png");
        assertTrue(ImageIO.write(deep, "png", file.toFile()));

        ImageProcessingException ex = assertThrows(ImageProcessingException.class, () -> ImageCodec.read(file));
        assertTrue(ex.getMessage().contains("16-bit"), ex.getMessage());
    }

    @Test
    void bilevelImagesAreStretchedToFullRange() {
        BufferedImage bilevel = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_BINARY);
        bilevel.getRaster().setSample(1, 0, 0, 1);

        PixelBuffer buffer = ImageCodec.fromImage(bilevel);

        assertEquals(0, buffer.get(0, 0));
        assertEquals(255, buffer.get(0, 1));
    }

    @Test
    void missingFileIsAnIoFailure() {
        assertThrows(UncheckedIOException.class, () -> ImageCodec.read(tempDir.resolve("missing.png")));
    }

    @Test
    void formatFollowsExtension() {
        assertEquals("jpeg", ImageCodec.formatFor(Path.of("RA_1.0__DEC_2.0.jpeg")));
        assertEquals("jpeg", ImageCodec.formatFor(Path.of("a.JPG")));
        assertEquals("png", ImageCodec.formatFor(Path.of("a.png")));
        assertThrows(ImageProcessingException.class, () -> ImageCodec.formatFor(Path.of("a.fits")));
    }
}
