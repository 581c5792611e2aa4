package com.skystack.pipeline.api;

import com.skystack.pipeline.image.PixelBuffer;

@FunctionalInterface
public interface ImageSmoother {
    ImageSmoother NONE = buffer -> buffer;

    PixelBuffer smooth(PixelBuffer buffer);
}
