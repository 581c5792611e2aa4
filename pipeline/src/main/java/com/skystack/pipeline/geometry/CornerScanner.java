package com.skystack.pipeline.geometry;

import com.skystack.pipeline.image.ImageProcessingException;
import com.skystack.pipeline.image.PixelBuffer;

import java.util.Optional;

public final class CornerScanner {
    private CornerScanner() {
    }

    // Top and bottom scan rows (columns ascending); left and right scan columns (rows ascending).
    public static Corners findCorners(PixelBuffer gray, PixelPredicate predicate, int threshold) {
        Corner top = null;
        for (int row = 0; row < gray.height() && top == null; row++) {
            top = firstInRow(gray, row, predicate, threshold);
        }
        Corner bottom = null;
        for (int row = gray.height() - 1; row >= 0 && bottom == null; row--) {
            bottom = firstInRow(gray, row, predicate, threshold);
        }
        Corner left = null;
        for (int col = 0; col < gray.width() && left == null; col++) {
            left = firstInColumn(gray, col, predicate, threshold);
        }
        Corner right = null;
        for (int col = gray.width() - 1; col >= 0 && right == null; col--) {
            right = firstInColumn(gray, col, predicate, threshold);
        }
        if (top == null || bottom == null || left == null || right == null) {
            throw new ImageProcessingException("No pixel matches threshold " + threshold);
        }
        return new Corners(top, bottom, left, right);
    }

    public static Optional<Corner> walk(PixelBuffer gray, int row, int col, int rowStep, int colStep,
                                        PixelPredicate predicate, int threshold) {
        int r = row;
        int c = col;
        while (gray.contains(r, c)) {
            int value = gray.get(r, c);
            if (predicate.test(value, threshold)) {
                return Optional.of(new Corner(r, c, value));
            }
            r += rowStep;
            c += colStep;
        }
        return Optional.empty();
    }

    private static Corner firstInRow(PixelBuffer gray, int row, PixelPredicate predicate, int threshold) {
        for (int col = 0; col < gray.width(); col++) {
            int value = gray.get(row, col);
            if (predicate.test(value, threshold)) {
                return new Corner(row, col, value);
            }
        }
        return null;
    }

    private static Corner firstInColumn(PixelBuffer gray, int col, PixelPredicate predicate, int threshold) {
        for (int row = 0; row < gray.height(); row++) {
            int value = gray.get(row, col);
            if (predicate.test(value, threshold)) {
                return new Corner(row, col, value);
            }
        }
        return null;
    }
}
