package com.starscape.borderframe.features.composite.app;

import com.starscape.borderframe.features.composite.domain.BorderColor;
import com.starscape.borderframe.features.planframe.domain.CanvasSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.DataBufferInt;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.util.Arrays;

/**
 * Builds the framed RGB image:
 * - Flattens transparency onto the border color
 * - Grows the image by the border on every edge
 * - Centers the result on the planned canvas
 *
 * Source pixels are only ever translated, never resampled.
 * All buffers are fully initialised, so the same input always yields the same pixels.
 */
@Component
public class Compositor {

    private static final Logger log = LoggerFactory.getLogger(Compositor.class);

    /**
     * Produce the final image for the planned canvas.
     *
     * @param source      decoded source image, any color model
     * @param borderSize  border in pixels, zero or more
     * @param target      canvas planned for this source and border
     * @param borderColor fill for border, padding and transparent pixels
     * @return a {@code TYPE_INT_RGB} image exactly the size of {@code target}
     */
    public BufferedImage composite(BufferedImage source, int borderSize, CanvasSize target, BorderColor borderColor) {
        BufferedImage flattened = flatten(source, borderColor);
        BufferedImage bordered = expandBorder(flattened, borderSize, borderColor);
        BufferedImage result = padToCanvas(bordered, target, borderColor);

        log.debug("Composited {}x{} source onto {} canvas (border={}, color={})",
            source.getWidth(), source.getHeight(), target, borderSize, borderColor);
        return result;
    }

    /**
     * Convert any source to opaque RGB of the same size.
     * Pixels with alpha are blended against the border color, weighted by their alpha.
     * Grayscale samples are replicated into the three channels.
     */
    public BufferedImage flatten(BufferedImage source, BorderColor borderColor) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] out = pixels(result);
        int background = borderColor.rgb();

        ColorModel colorModel = source.getColorModel();
        Raster raster = source.getRaster();
        int colorBands = raster.getNumBands() - (colorModel.hasAlpha() ? 1 : 0);
        int colorSpaceType = colorModel.getColorSpace().getType();
        boolean directSamples = !(colorModel instanceof IndexColorModel)
            && ((colorBands == 3 && colorSpaceType == ColorSpace.TYPE_RGB)
                || (colorBands == 1 && colorSpaceType == ColorSpace.TYPE_GRAY));

        if (directSamples) {
            flattenSamples(raster, colorModel, colorBands, background, out, width, height);
        } else {
            // Palette and exotic color models go through the standard ARGB conversion
            int[] argb = source.getRGB(0, 0, width, height, null, 0, width);
            for (int i = 0; i < argb.length; i++) {
                out[i] = blend(argb[i] & 0xFFFFFF, background, argb[i] >>> 24);
            }
        }
        return result;
    }

    /**
     * Grow the image by {@code borderSize} pixels on every edge, filled with the border color.
     */
    public BufferedImage expandBorder(BufferedImage image, int borderSize, BorderColor borderColor) {
        if (borderSize < 0) {
            throw new IllegalArgumentException("Border must not be negative: " + borderSize);
        }
        if (borderSize == 0) {
            return image;
        }
        BufferedImage result = canvas(
            image.getWidth() + 2 * borderSize,
            image.getHeight() + 2 * borderSize,
            borderColor);
        paste(image, result, borderSize, borderSize);
        return result;
    }

    /**
     * Center the image on a canvas of the target size.
     * Odd remainders leave the extra pixel on the right and bottom.
     */
    public BufferedImage padToCanvas(BufferedImage image, CanvasSize target, BorderColor borderColor) {
        int currentWidth = image.getWidth();
        int currentHeight = image.getHeight();
        if (target.width() < currentWidth || target.height() < currentHeight) {
            throw new IllegalArgumentException(
                "Canvas " + target + " is smaller than image " + currentWidth + "x" + currentHeight);
        }
        if (target.width() == currentWidth && target.height() == currentHeight) {
            return image;
        }
        BufferedImage result = canvas(target.width(), target.height(), borderColor);
        int offsetX = (target.width() - currentWidth) / 2;
        int offsetY = (target.height() - currentHeight) / 2;
        paste(image, result, offsetX, offsetY);
        return result;
    }

    private void flattenSamples(Raster raster, ColorModel colorModel, int colorBands,
                                int background, int[] out, int width, int height) {
        int bands = raster.getNumBands();
        boolean hasAlpha = colorModel.hasAlpha();
        boolean premultiplied = colorModel.isAlphaPremultiplied();
        long[] maxima = new long[bands];
        for (int b = 0; b < bands; b++) {
            maxima[b] = (1L << raster.getSampleModel().getSampleSize(b)) - 1;
        }

        int minX = raster.getMinX();
        int minY = raster.getMinY();
        int[] pixel = new int[bands];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                raster.getPixel(minX + x, minY + y, pixel);
                int red = scale(pixel[0], maxima[0]);
                int green = colorBands == 3 ? scale(pixel[1], maxima[1]) : red;
                int blue = colorBands == 3 ? scale(pixel[2], maxima[2]) : red;
                int rgb;
                if (hasAlpha) {
                    int alpha = scale(pixel[bands - 1], maxima[bands - 1]);
                    if (premultiplied && alpha > 0) {
                        red = Math.min(255, red * 255 / alpha);
                        green = Math.min(255, green * 255 / alpha);
                        blue = Math.min(255, blue * 255 / alpha);
                    }
                    rgb = blend((red << 16) | (green << 8) | blue, background, alpha);
                } else {
                    rgb = (red << 16) | (green << 8) | blue;
                }
                out[y * width + x] = rgb;
            }
        }
    }

    /**
     * Alpha-weighted blend of one RGB pixel over another, rounded to nearest.
     */
    static int blend(int foreground, int background, int alpha) {
        if (alpha >= 255) {
            return foreground;
        }
        if (alpha <= 0) {
            return background;
        }
        int inverse = 255 - alpha;
        int red = (((foreground >> 16) & 0xFF) * alpha + ((background >> 16) & 0xFF) * inverse + 127) / 255;
        int green = (((foreground >> 8) & 0xFF) * alpha + ((background >> 8) & 0xFF) * inverse + 127) / 255;
        int blue = ((foreground & 0xFF) * alpha + (background & 0xFF) * inverse + 127) / 255;
        return (red << 16) | (green << 8) | blue;
    }

    private static int scale(int sample, long maximum) {
        if (maximum == 255) {
            return sample;
        }
        return (int) ((sample * 255L + maximum / 2) / maximum);
    }

    private static BufferedImage canvas(int width, int height, BorderColor color) {
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Arrays.fill(pixels(canvas), color.rgb());
        return canvas;
    }

    private static void paste(BufferedImage image, BufferedImage canvas, int offsetX, int offsetY) {
        int[] source = pixels(image);
        int[] target = pixels(canvas);
        int width = image.getWidth();
        int canvasWidth = canvas.getWidth();
        for (int y = 0; y < image.getHeight(); y++) {
            System.arraycopy(source, y * width, target, (offsetY + y) * canvasWidth + offsetX, width);
        }
    }

    private static int[] pixels(BufferedImage image) {
        if (image.getType() != BufferedImage.TYPE_INT_RGB || image.getRaster().getParent() != null) {
            throw new IllegalArgumentException("Expected a flattened TYPE_INT_RGB image, got type " + image.getType());
        }
        return ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
    }
}
