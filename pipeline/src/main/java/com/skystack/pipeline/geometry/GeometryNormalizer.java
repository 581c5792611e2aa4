package com.skystack.pipeline.geometry;

import com.skystack.pipeline.image.ImageCodec;
import com.skystack.pipeline.image.ImageProcessingException;
import com.skystack.pipeline.image.PixelBuffer;

import java.nio.file.Path;
import java.util.logging.Logger;

public final class GeometryNormalizer {
    private static final Logger LOGGER = Logger.getLogger(GeometryNormalizer.class.getName());

    public static final int WHITE = 255;
    public static final int BLACK = 0;

    private final int whiteLevel;

    public GeometryNormalizer() {
        this(WHITE);
    }

    public GeometryNormalizer(int whiteLevel) {
        if (whiteLevel < 1 || whiteLevel > WHITE) {
            throw new IllegalArgumentException("whiteLevel must be in [1, 255]: " + whiteLevel);
        }
        this.whiteLevel = whiteLevel;
    }

    public void straighten(Path image) {
        PixelBuffer straightened = straighten(ImageCodec.read(image));
        ImageCodec.write(straightened, image);
    }

    public PixelBuffer straighten(PixelBuffer exposure) {
        PixelBuffer gray = exposure.toGray();
        if (isZoomedIn(gray)) {
            LOGGER.fine("Exposure fills the frame; cropping without rotation");
            return cropZoomed(gray);
        }
        return straightenRotated(gray);
    }

    // Content running down the left edge means the frame clips the footprint.
    public boolean isZoomedIn(PixelBuffer gray) {
        var fromTop = CornerScanner.walk(gray, 0, 0, 1, 0, PixelPredicate.LESS_THAN, whiteLevel);
        var fromBottom = CornerScanner.walk(gray, gray.height() - 1, 0, -1, 0, PixelPredicate.LESS_THAN, whiteLevel);
        return fromTop.isPresent() && fromBottom.isPresent() && fromTop.get().row() != fromBottom.get().row();
    }

    PixelBuffer straightenRotated(PixelBuffer gray) {
        Corners corners = CornerScanner.findCorners(gray, PixelPredicate.LESS_THAN, whiteLevel);
        double angle = 90.0 - rotationAngle(corners);
        PixelBuffer rotated = Rotation.rotate(gray, angle, BLACK);

        // The rotated frame sits on black fill; its apexes lie outside the now upright footprint.
        Corners frame = CornerScanner.findCorners(rotated, PixelPredicate.GREATER_THAN, BLACK);
        int top = scan(rotated, frame.top(), 1, 0, "top").row();
        int bottom = scan(rotated, frame.bottom(), -1, 0, "bottom").row();
        int left = scan(rotated, frame.left(), 0, 1, "left").col();
        int right = scan(rotated, frame.right(), 0, -1, "right").col();
        if (bottom <= top || right <= left) {
            throw new ImageProcessingException("Degenerate footprint after rotating by " + angle + " degrees");
        }
        return rotated.crop(top, bottom, left, right);
    }

    PixelBuffer cropZoomed(PixelBuffer gray) {
        int lastRow = gray.height() - 1;
        int lastCol = gray.width() - 1;
        Corner topLeft = diagonal(gray, 0, 0, 1, 1, "top-left");
        Corner topRight = diagonal(gray, 0, lastCol, 1, -1, "top-right");
        Corner bottomLeft = diagonal(gray, lastRow, 0, -1, 1, "bottom-left");
        Corner bottomRight = diagonal(gray, lastRow, lastCol, -1, -1, "bottom-right");
        int top = Math.max(topLeft.row(), topRight.row());
        int bottom = Math.min(bottomLeft.row(), bottomRight.row());
        int left = Math.max(topLeft.col(), bottomLeft.col());
        int right = Math.min(topRight.col(), bottomRight.col());
        return gray.crop(top, bottom, left, right);
    }

    static double rotationAngle(Corners corners) {
        double rowDelta = corners.right().row() - corners.top().row();
        double colDelta = corners.right().col() - corners.top().col();
        return Math.toDegrees(Math.atan2(rowDelta, colDelta));
    }

    private Corner scan(PixelBuffer rotated, Corner start, int rowStep, int colStep, String side) {
        return CornerScanner.walk(rotated, start.row(), start.col(), rowStep, colStep, PixelPredicate.LESS_THAN, whiteLevel)
                .orElseThrow(() -> new ImageProcessingException("No content found scanning inward from the " + side + " corner"));
    }

    private Corner diagonal(PixelBuffer gray, int row, int col, int rowStep, int colStep, String corner) {
        return CornerScanner.walk(gray, row, col, rowStep, colStep, PixelPredicate.LESS_THAN, whiteLevel)
                .orElseThrow(() -> new ImageProcessingException("No content on the diagonal from the " + corner + " corner"));
    }
}
