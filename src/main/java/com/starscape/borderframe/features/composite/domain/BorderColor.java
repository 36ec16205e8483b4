package com.starscape.borderframe.features.composite.domain;

import com.starscape.borderframe.common.domain.ValueObject;
import com.starscape.borderframe.common.exception.InvalidSettingsException;

import java.util.Locale;

/**
 * Opaque RGB color used for the border, the aspect padding and the
 * background that transparent pixels are flattened onto.
 */
public record BorderColor(
    int red,
    int green,
    int blue
) implements ValueObject {

    public static final BorderColor WHITE = new BorderColor(255, 255, 255);
    public static final BorderColor BLACK = new BorderColor(0, 0, 0);

    public BorderColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    /**
     * Parse {@code #rrggbb} (the leading hash is optional).
     */
    public static BorderColor parse(String hex) {
        if (hex == null) {
            throw new InvalidSettingsException("Border color must not be null");
        }
        String digits = hex.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        if (digits.length() != 6) {
            throw new InvalidSettingsException("Border color must look like #rrggbb, got: " + hex);
        }
        try {
            int rgb = Integer.parseInt(digits, 16);
            return fromRgb(rgb);
        } catch (NumberFormatException e) {
            throw new InvalidSettingsException("Border color must look like #rrggbb, got: " + hex, e);
        }
    }

    public static BorderColor fromRgb(int rgb) {
        return new BorderColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    /**
     * Packed 0xRRGGBB value as used by {@code TYPE_INT_RGB} rasters.
     */
    public int rgb() {
        return (red << 16) | (green << 8) | blue;
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new InvalidSettingsException("Border color " + name + " channel out of range: " + value);
        }
    }

    @Override
    public String toString() {
        return toHex();
    }
}
