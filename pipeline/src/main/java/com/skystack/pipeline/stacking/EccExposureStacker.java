package com.skystack.pipeline.stacking;

import com.skystack.pipeline.api.ExposureStacker;
import com.skystack.pipeline.image.ImageCodec;
import com.skystack.pipeline.image.ImageProcessingException;
import com.skystack.pipeline.image.OpenCvImages;
import com.skystack.pipeline.image.PixelBuffer;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.TermCriteria;
import org.opencv.imgproc.Imgproc;
import org.opencv.video.Video;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public final class EccExposureStacker implements ExposureStacker {
    private static final Logger LOGGER = Logger.getLogger(EccExposureStacker.class.getName());

    private static final int MAX_ITERATIONS = 200;
    private static final double EPSILON = 1e-6;
    private static final int GAUSSIAN_FILTER_SIZE = 5;

    private final int motionType;

    public EccExposureStacker() {
        this(Video.MOTION_TRANSLATION);
    }

    public EccExposureStacker(int motionType) {
        if (motionType != Video.MOTION_TRANSLATION && motionType != Video.MOTION_EUCLIDEAN
                && motionType != Video.MOTION_AFFINE && motionType != Video.MOTION_HOMOGRAPHY) {
            throw new IllegalArgumentException("Unknown ECC motion type: " + motionType);
        }
        this.motionType = motionType;
    }

    @Override
    public PixelBuffer stack(List<Path> exposures) {
        if (exposures == null || exposures.isEmpty()) {
            throw new ImageProcessingException("Nothing to stack");
        }
        List<PixelBuffer> frames = commonExtent(exposures);
        Mat template = toFloat(frames.get(0));
        Mat sum = template.clone();
        Mat warp = Mat.eye(motionType == Video.MOTION_HOMOGRAPHY ? 3 : 2, 3, CvType.CV_32F);
        Mat mean = new Mat();
        try {
            for (int index = 1; index < frames.size(); index++) {
                Mat frame = toFloat(frames.get(index));
                try {
                    if (Core.norm(frame, template, Core.NORM_INF) == 0.0) {
                        Core.add(sum, frame, sum);
                    } else {
                        Mat aligned = register(template, frame, warp, exposures.get(index));
                        Core.add(sum, aligned, sum);
                        aligned.release();
                    }
                } finally {
                    frame.release();
                }
            }
            sum.convertTo(mean, CvType.CV_8U, 1.0 / frames.size());
            PixelBuffer stacked = OpenCvImages.fromMat(mean);
            LOGGER.fine("Stacked " + frames.size() + " exposures into " + stacked);
            return stacked;
        } finally {
            template.release();
            sum.release();
            warp.release();
            mean.release();
        }
    }

    private Mat register(Mat template, Mat frame, Mat warp, Path exposure) {
        TermCriteria criteria = new TermCriteria(TermCriteria.COUNT + TermCriteria.EPS, MAX_ITERATIONS, EPSILON);
        try {
            double correlation = Video.findTransformECC(template, frame, warp, motionType, criteria, new Mat(), GAUSSIAN_FILTER_SIZE);
            LOGGER.fine("Registered " + exposure + " with correlation " + correlation);
        } catch (CvException e) {
            throw new ImageProcessingException("Unable to register " + exposure + " against the first exposure", e);
        }
        Mat aligned = new Mat();
        int flags = Imgproc.INTER_LINEAR + Imgproc.WARP_INVERSE_MAP;
        if (motionType == Video.MOTION_HOMOGRAPHY) {
            Imgproc.warpPerspective(frame, aligned, warp, template.size(), flags);
        } else {
            Imgproc.warpAffine(frame, aligned, warp, template.size(), flags);
        }
        return aligned;
    }

    // Straightened exposures can differ by a pixel or two; keep the centred common extent.
    private static List<PixelBuffer> commonExtent(List<Path> exposures) {
        List<PixelBuffer> frames = new ArrayList<>();
        int height = Integer.MAX_VALUE;
        int width = Integer.MAX_VALUE;
        for (Path exposure : exposures) {
            PixelBuffer frame = ImageCodec.read(exposure).toGray();
            frames.add(frame);
            height = Math.min(height, frame.height());
            width = Math.min(width, frame.width());
        }
        List<PixelBuffer> cropped = new ArrayList<>(frames.size());
        for (PixelBuffer frame : frames) {
            int rowOffset = (frame.height() - height) / 2;
            int colOffset = (frame.width() - width) / 2;
            cropped.add(frame.crop(rowOffset, rowOffset + height, colOffset, colOffset + width));
        }
        return cropped;
    }

    private static Mat toFloat(PixelBuffer frame) {
        Mat bytes = OpenCvImages.toMat(frame);
        Mat floats = new Mat();
        bytes.convertTo(floats, CvType.CV_32F);
        bytes.release();
        return floats;
    }
}
