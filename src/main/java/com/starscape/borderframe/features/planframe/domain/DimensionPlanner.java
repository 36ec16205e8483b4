package com.starscape.borderframe.features.planframe.domain;

/**
 * Computes the output canvas for a bordered image.
 * <p>
 * The canvas is the source grown by the border on every edge, then widened or
 * heightened (never shrunk) until it matches the requested aspect ratio.
 * The cross dimension is truncated, not rounded, so results are reproducible
 * across platforms.
 */
public final class DimensionPlanner {

    /** Shorter-side length against which a proportional border unit is measured. */
    public static final int REFERENCE_SIZE = 1000;

    private DimensionPlanner() {
    }

    /**
     * Plan the canvas for a source of the given size.
     *
     * @param imageWidth  source width, positive
     * @param imageHeight source height, positive
     * @param border      border thickness in pixels, zero or more
     * @param aspect      target ratio, or null to keep the border-only size
     * @return the planned canvas, never smaller than the border-only minimum
     */
    public static CanvasSize plan(int imageWidth, int imageHeight, int border, AspectRatio aspect) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException(
                "Image dimensions must be positive: " + imageWidth + "x" + imageHeight);
        }
        if (border < 0) {
            throw new IllegalArgumentException("Border must not be negative: " + border);
        }

        int minWidth = Math.addExact(imageWidth, Math.multiplyExact(border, 2));
        int minHeight = Math.addExact(imageHeight, Math.multiplyExact(border, 2));
        if (aspect == null) {
            return new CanvasSize(minWidth, minHeight);
        }

        double targetRatio = aspect.ratio();
        double currentRatio = (double) minWidth / minHeight;

        int width;
        int height;
        if (currentRatio > targetRatio) {
            width = minWidth;
            height = Math.max(truncate(width / targetRatio), minHeight);
        } else {
            height = minHeight;
            width = Math.max(truncate(height * targetRatio), minWidth);
        }
        return new CanvasSize(width, height);
    }

    private static int truncate(double size) {
        if (size >= Integer.MAX_VALUE + 1.0) {
            throw new ArithmeticException("Canvas dimension out of range: " + size);
        }
        return (int) size;
    }

    /**
     * Plan the canvas with a border that scales with the shorter image side.
     *
     * @param borderUnit border thickness per {@link #REFERENCE_SIZE} pixels of shorter side
     */
    public static CanvasSize planProportional(int imageWidth, int imageHeight, int borderUnit, AspectRatio aspect) {
        return plan(imageWidth, imageHeight, proportionalBorder(borderUnit, imageWidth, imageHeight), aspect);
    }

    /**
     * Derive a pixel border from a proportional unit: {@code unit * min(w, h) / 1000}, truncated.
     */
    public static int proportionalBorder(int borderUnit, int imageWidth, int imageHeight) {
        if (borderUnit < 0) {
            throw new IllegalArgumentException("Border unit must not be negative: " + borderUnit);
        }
        long shorterSide = Math.min(imageWidth, imageHeight);
        return Math.toIntExact(borderUnit * shorterSide / REFERENCE_SIZE);
    }

    /**
     * Resolve the pixel border for an image according to the border mode.
     */
    public static int resolveBorder(BorderMode mode, int borderValue, int imageWidth, int imageHeight) {
        return mode == BorderMode.PROPORTIONAL
            ? proportionalBorder(borderValue, imageWidth, imageHeight)
            : borderValue;
    }
}
