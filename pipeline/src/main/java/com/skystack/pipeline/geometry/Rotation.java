package com.skystack.pipeline.geometry;

import com.skystack.pipeline.image.OpenCvImages;
import com.skystack.pipeline.image.PixelBuffer;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

public final class Rotation {
    private static final double SIZE_EPSILON = 1e-6;

    private Rotation() {
    }

    // Positive angles turn the content clockwise as displayed; the canvas grows to hold all of it.
    public static PixelBuffer rotate(PixelBuffer source, double degrees, int fill) {
        double radians = Math.toRadians(degrees);
        double cos = Math.abs(Math.cos(radians));
        double sin = Math.abs(Math.sin(radians));
        int width = source.width();
        int height = source.height();
        int outWidth = expandedSize(width * cos + height * sin);
        int outHeight = expandedSize(width * sin + height * cos);

        Mat src = OpenCvImages.toMat(source);
        Mat transform = Imgproc.getRotationMatrix2D(new Point((width - 1) / 2.0, (height - 1) / 2.0), -degrees, 1.0);
        transform.put(0, 2, transform.get(0, 2)[0] + (outWidth - width) / 2.0);
        transform.put(1, 2, transform.get(1, 2)[0] + (outHeight - height) / 2.0);
        Mat rotated = new Mat();
        try {
            Imgproc.warpAffine(src, rotated, transform, new Size(outWidth, outHeight),
                    Imgproc.INTER_NEAREST, Core.BORDER_CONSTANT, new Scalar(fill, fill, fill));
            return OpenCvImages.fromMat(rotated);
        } finally {
            src.release();
            transform.release();
            rotated.release();
        }
    }

    private static int expandedSize(double extent) {
        return Math.max(1, (int) Math.ceil(extent - SIZE_EPSILON));
    }
}
