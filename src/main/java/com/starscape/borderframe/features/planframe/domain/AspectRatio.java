package com.starscape.borderframe.features.planframe.domain;

import com.starscape.borderframe.common.domain.ValueObject;
import com.starscape.borderframe.common.exception.InvalidSettingsException;

import java.util.Optional;

/**
 * Target width-to-height ratio of the output canvas, e.g. 4:5.
 */
public record AspectRatio(
    int width,
    int height
) implements ValueObject {

    public static final AspectRatio SQUARE = new AspectRatio(1, 1);
    public static final AspectRatio PORTRAIT = new AspectRatio(4, 5);
    public static final AspectRatio LANDSCAPE = new AspectRatio(5, 4);
    public static final AspectRatio STORY = new AspectRatio(9, 16);
    public static final AspectRatio BANNER = new AspectRatio(2, 1);

    public AspectRatio {
        if (width <= 0 || height <= 0) {
            throw new InvalidSettingsException(
                "Aspect ratio terms must be positive: " + width + ":" + height);
        }
    }

    public double ratio() {
        return (double) width / height;
    }

    /**
     * Parse a ratio written as {@code w:h}.
     * Blank input and {@code original} mean "keep the border-only canvas".
     *
     * @param value The ratio text, may be null
     * @return the ratio, or empty when no ratio is requested
     * @throws InvalidSettingsException if the text is not a valid ratio
     */
    public static Optional<AspectRatio> parse(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("original")) {
            return Optional.empty();
        }
        String[] parts = value.trim().split(":");
        if (parts.length != 2) {
            throw new InvalidSettingsException("Aspect ratio must look like w:h, got: " + value);
        }
        try {
            return Optional.of(new AspectRatio(
                Integer.parseInt(parts[0].trim()),
                Integer.parseInt(parts[1].trim())));
        } catch (NumberFormatException e) {
            throw new InvalidSettingsException("Aspect ratio must look like w:h, got: " + value, e);
        }
    }

    @Override
    public String toString() {
        return width + ":" + height;
    }
}
