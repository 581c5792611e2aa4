package com.skystack.pipeline.stacking;

import com.skystack.pipeline.api.ImageSmoother;
import com.skystack.pipeline.image.OpenCvImages;
import com.skystack.pipeline.image.PixelBuffer;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

public final class BilateralSmoother implements ImageSmoother {
    private final int diameter;
    private final double sigmaColor;
    private final double sigmaSpace;

    public BilateralSmoother() {
        this(5, 75.0, 75.0);
    }

    public BilateralSmoother(int diameter, double sigmaColor, double sigmaSpace) {
        if (diameter < 1) {
            throw new IllegalArgumentException("diameter must be positive: " + diameter);
        }
        if (sigmaColor <= 0.0 || sigmaSpace <= 0.0) {
            throw new IllegalArgumentException("sigmas must be positive");
        }
        this.diameter = diameter;
        this.sigmaColor = sigmaColor;
        this.sigmaSpace = sigmaSpace;
    }

    @Override
    public PixelBuffer smooth(PixelBuffer buffer) {
        Mat src = OpenCvImages.toMat(buffer);
        Mat smoothed = new Mat();
        try {
            Imgproc.bilateralFilter(src, smoothed, diameter, sigmaColor, sigmaSpace, Core.BORDER_REPLICATE);
            return OpenCvImages.fromMat(smoothed);
        } finally {
            src.release();
            smoothed.release();
        }
    }
}
