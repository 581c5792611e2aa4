package com.skystack.pipeline.image;

import java.util.Arrays;

public final class PixelBuffer {
    public static final int MAX_VALUE = 255;

    private final int height;
    private final int width;
    private final int channels;
    private final int[] samples;

    public PixelBuffer(int height, int width, int channels) {
        if (height < 1 || width < 1) {
            throw new ImageProcessingException("Image must have at least one pixel: " + height + "x" + width);
        }
        if (channels != 1 && channels != 3) {
            throw new ImageProcessingException("Unsupported channel count: " + channels);
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.samples = new int[height * width * channels];
    }

    public static PixelBuffer gray(int height, int width, int fill) {
        PixelBuffer buffer = new PixelBuffer(height, width, 1);
        Arrays.fill(buffer.samples, fill);
        return buffer;
    }

    public static PixelBuffer ofRows(int[][] rows) {
        if (rows.length == 0 || rows[0].length == 0) {
            throw new ImageProcessingException("Image must have at least one pixel");
        }
        PixelBuffer buffer = new PixelBuffer(rows.length, rows[0].length, 1);
        for (int row = 0; row < rows.length; row++) {
            if (rows[row].length != buffer.width) {
                throw new ImageProcessingException("Ragged row " + row);
            }
            for (int col = 0; col < buffer.width; col++) {
                buffer.set(row, col, rows[row][col]);
            }
        }
        return buffer;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public int channels() {
        return channels;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    public int get(int row, int col) {
        return get(row, col, 0);
    }

    public int get(int row, int col, int channel) {
        return samples[index(row, col) + channel];
    }

    public void set(int row, int col, int value) {
        for (int channel = 0; channel < channels; channel++) {
            set(row, col, channel, value);
        }
    }

    public void set(int row, int col, int channel, int value) {
        samples[index(row, col) + channel] = value;
    }

    public void fill(int value) {
        Arrays.fill(samples, value);
    }

    public PixelBuffer toGray() {
        if (channels == 1) {
            return copy();
        }
        PixelBuffer gray = new PixelBuffer(height, width, 1);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                double luma = 0.299 * get(row, col, 0) + 0.587 * get(row, col, 1) + 0.114 * get(row, col, 2);
                gray.set(row, col, 0, (int) Math.round(luma));
            }
        }
        return gray;
    }

    // [rowStart, rowEnd) x [colStart, colEnd)
    public PixelBuffer crop(int rowStart, int rowEnd, int colStart, int colEnd) {
        if (rowStart < 0 || colStart < 0 || rowEnd > height || colEnd > width
                || rowEnd <= rowStart || colEnd <= colStart) {
            throw new ImageProcessingException("Empty or out-of-bounds crop [" + rowStart + "," + rowEnd + ")x["
                    + colStart + "," + colEnd + ") of " + height + "x" + width);
        }
        PixelBuffer cropped = new PixelBuffer(rowEnd - rowStart, colEnd - colStart, channels);
        int rowLength = cropped.width * channels;
        for (int row = rowStart; row < rowEnd; row++) {
            System.arraycopy(samples, index(row, colStart), cropped.samples, (row - rowStart) * rowLength, rowLength);
        }
        return cropped;
    }

    public PixelBuffer copy() {
        PixelBuffer copy = new PixelBuffer(height, width, channels);
        System.arraycopy(samples, 0, copy.samples, 0, samples.length);
        return copy;
    }

    int[] samples() {
        return samples;
    }

    private int index(int row, int col) {
        if (!contains(row, col)) {
            throw new IndexOutOfBoundsException("Pixel (" + row + "," + col + ") outside " + height + "x" + width);
        }
        return (row * width + col) * channels;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PixelBuffer that)) {
            return false;
        }
        return height == that.height && width == that.width && channels == that.channels
                && Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * height + width) + channels) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + height + "x" + width + "x" + channels + "]";
    }
}
