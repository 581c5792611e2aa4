package com.skystack.pipeline.config;

public enum AcquisitionMode {
    // every exposure of the largest group, straightened and stacked
    STACKED,
    // one archive-combined product, straightened in place
    PREPROCESSED,
    // one high-level science product per archive location, saved as-is
    ALL_SKY
}
