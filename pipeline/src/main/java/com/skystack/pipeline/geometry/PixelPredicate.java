package com.skystack.pipeline.geometry;

@FunctionalInterface
public interface PixelPredicate {
    PixelPredicate LESS_THAN = (value, threshold) -> value < threshold;
    PixelPredicate GREATER_THAN = (value, threshold) -> value > threshold;

    boolean test(int value, int threshold);
}
