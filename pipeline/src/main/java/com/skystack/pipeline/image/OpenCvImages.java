package com.skystack.pipeline.image;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.util.logging.Logger;

public final class OpenCvImages {
    private static final Logger LOGGER = Logger.getLogger(OpenCvImages.class.getName());

    private static boolean loaded;

    private OpenCvImages() {
    }

    public static synchronized void load() {
        if (!loaded) {
            OpenCV.loadLocally();
            loaded = true;
            LOGGER.fine("Loaded OpenCV " + Core.VERSION);
        }
    }

    public static Mat toMat(PixelBuffer buffer) {
        load();
        int[] samples = buffer.samples();
        byte[] data = new byte[samples.length];
        for (int i = 0; i < samples.length; i++) {
            data[i] = (byte) Math.max(0, Math.min(PixelBuffer.MAX_VALUE, samples[i]));
        }
        Mat mat = new Mat(buffer.height(), buffer.width(), buffer.channels() == 1 ? CvType.CV_8UC1 : CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }

    public static PixelBuffer fromMat(Mat mat) {
        if (mat.depth() != CvType.CV_8U) {
            throw new ImageProcessingException("Expected an 8-bit matrix, got " + CvType.typeToString(mat.type()));
        }
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        PixelBuffer buffer = new PixelBuffer(continuous.rows(), continuous.cols(), continuous.channels());
        int[] samples = buffer.samples();
        byte[] data = new byte[samples.length];
        continuous.get(0, 0, data);
        for (int i = 0; i < data.length; i++) {
            samples[i] = data[i] & 0xFF;
        }
        return buffer;
    }
}
