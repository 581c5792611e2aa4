package com.skystack.pipeline.contrast;

import com.skystack.pipeline.image.ImageProcessingException;
import com.skystack.pipeline.image.PixelBuffer;

public final class ContrastEnhancer {
    public static final int LEVELS = 256;

    public PixelBuffer equalize(PixelBuffer buffer) {
        int[] lookup = lookupTable(buffer);
        if (lookup == null) {
            return buffer;
        }
        PixelBuffer out = new PixelBuffer(buffer.height(), buffer.width(), buffer.channels());
        for (int row = 0; row < buffer.height(); row++) {
            for (int col = 0; col < buffer.width(); col++) {
                for (int channel = 0; channel < buffer.channels(); channel++) {
                    out.set(row, col, channel, lookup[buffer.get(row, col, channel)]);
                }
            }
        }
        return out;
    }

    static long[] histogram(PixelBuffer buffer) {
        long[] histogram = new long[LEVELS];
        for (int row = 0; row < buffer.height(); row++) {
            for (int col = 0; col < buffer.width(); col++) {
                for (int channel = 0; channel < buffer.channels(); channel++) {
                    int value = buffer.get(row, col, channel);
                    if (value < 0 || value >= LEVELS) {
                        throw new ImageProcessingException("Sample out of 8-bit range at (" + row + "," + col + "): " + value);
                    }
                    histogram[value]++;
                }
            }
        }
        return histogram;
    }

    static int[] lookupTable(PixelBuffer buffer) {
        long[] cumulative = histogram(buffer);
        for (int level = 1; level < LEVELS; level++) {
            cumulative[level] += cumulative[level - 1];
        }
        long min = 0;
        for (long count : cumulative) {
            if (count > 0) {
                min = count;
                break;
            }
        }
        long max = cumulative[LEVELS - 1];
        if (max == min) {
            return null;
        }
        int[] lookup = new int[LEVELS];
        for (int level = 0; level < LEVELS; level++) {
            long scaled = (cumulative[level] - min) * (LEVELS - 1) / (max - min);
            lookup[level] = (int) Math.max(0, scaled);
        }
        return lookup;
    }
}
