package com.skystack.pipeline.geometry;

public record Corner(int row, int col, int value) {
}
