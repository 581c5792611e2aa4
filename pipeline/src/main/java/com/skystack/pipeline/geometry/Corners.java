package com.skystack.pipeline.geometry;

import java.util.Objects;

public record Corners(Corner top, Corner bottom, Corner left, Corner right) {
    public Corners {
        Objects.requireNonNull(top, "top is required");
        Objects.requireNonNull(bottom, "bottom is required");
        Objects.requireNonNull(left, "left is required");
        Objects.requireNonNull(right, "right is required");
    }
}
