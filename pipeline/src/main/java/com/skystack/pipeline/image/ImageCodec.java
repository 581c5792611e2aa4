package com.skystack.pipeline.image;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public final class ImageCodec {
    private ImageCodec() {
    }

    public static PixelBuffer read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new UncheckedIOException(new IOException("Image not found: " + path));
        }
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new ImageProcessingException("Unable to decode image " + path, e);
        }
        if (image == null) {
            throw new ImageProcessingException("Unsupported or corrupt image " + path);
        }
        return fromImage(image);
    }

    public static void write(PixelBuffer buffer, Path path) {
        String format = formatFor(path);
        BufferedImage image = toImage(buffer);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(image, format, path.toFile())) {
                throw new ImageProcessingException("No ImageIO writer for format " + format);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed writing image " + path, e);
        }
    }

    public static PixelBuffer fromImage(BufferedImage image) {
        int height = image.getHeight();
        int width = image.getWidth();
        Raster raster = image.getRaster();
        int[] sampleSizes = raster.getSampleModel().getSampleSize();
        for (int bits : sampleSizes) {
            if (bits > 8) {
                throw new ImageProcessingException("Unsupported " + bits + "-bit samples; expected 8 bits per channel");
            }
        }
        if (raster.getNumBands() == 1) {
            // Packed low-depth greys are stretched onto 0..255.
            int max = (1 << sampleSizes[0]) - 1;
            PixelBuffer gray = new PixelBuffer(height, width, 1);
            for (int row = 0; row < height; row++) {
                for (int col = 0; col < width; col++) {
                    gray.set(row, col, 0, raster.getSample(col, row, 0) * PixelBuffer.MAX_VALUE / max);
                }
            }
            return gray;
        }
        PixelBuffer rgb = new PixelBuffer(height, width, 3);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int argb = image.getRGB(col, row);
                rgb.set(row, col, 0, (argb >> 16) & 0xFF);
                rgb.set(row, col, 1, (argb >> 8) & 0xFF);
                rgb.set(row, col, 2, argb & 0xFF);
            }
        }
        return rgb;
    }

    public static BufferedImage toImage(PixelBuffer buffer) {
        int height = buffer.height();
        int width = buffer.width();
        if (buffer.channels() == 1) {
            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            WritableRaster raster = image.getRaster();
            for (int row = 0; row < height; row++) {
                for (int col = 0; col < width; col++) {
                    raster.setSample(col, row, 0, clamp(buffer.get(row, col, 0)));
                }
            }
            return image;
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int rgb = clamp(buffer.get(row, col, 0)) << 16
                        | clamp(buffer.get(row, col, 1)) << 8
                        | clamp(buffer.get(row, col, 2));
                image.setRGB(col, row, rgb);
            }
        }
        return image;
    }

    static String formatFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "" : name.substring(dot + 1);
        return switch (extension) {
            case "jpg", "jpeg" -> "jpeg";
            case "png" -> "png";
            case "bmp" -> "bmp";
            default -> throw new ImageProcessingException("Unsupported image extension: " + path.getFileName());
        };
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(PixelBuffer.MAX_VALUE, value));
    }
}
