package com.starscape.borderframe.features.batch.domain;

import com.starscape.borderframe.common.exception.InvalidSettingsException;
import com.starscape.borderframe.features.composite.domain.BorderColor;
import com.starscape.borderframe.features.export.domain.SaveFormat;
import com.starscape.borderframe.features.planframe.domain.AspectRatio;
import com.starscape.borderframe.features.planframe.domain.BorderMode;
import com.starscape.borderframe.features.planframe.domain.DimensionPlanner;

import java.util.Optional;

/**
 * Immutable configuration of one batch, validated on construction and shared
 * read-only by every job of the batch.
 *
 * @param baseFilename     output name prefix, null to derive names from the sources
 * @param aspectRatio      target canvas ratio, null to keep the border-only canvas
 * @param borderSize       border in pixels, or a proportional unit when {@code borderMode} is PROPORTIONAL
 * @param borderMode       how {@code borderSize} is interpreted
 * @param saveFormat       output codec
 * @param quality          1..100 for JPEG and HEIF, null for PNG and TIFF
 * @param preserveMetadata whether to keep the GPS block of the sources
 * @param borderColor      border, padding and transparency background color
 */
public record Settings(
    String baseFilename,
    AspectRatio aspectRatio,
    int borderSize,
    BorderMode borderMode,
    SaveFormat saveFormat,
    Integer quality,
    boolean preserveMetadata,
    BorderColor borderColor
) {

    public Settings {
        if (baseFilename != null) {
            baseFilename = baseFilename.trim();
            if (baseFilename.isEmpty()) {
                baseFilename = null;
            }
        }
        if (borderSize < 0) {
            throw new InvalidSettingsException("Border size must not be negative: " + borderSize);
        }
        if (borderMode == null) {
            borderMode = BorderMode.FIXED;
        }
        if (saveFormat == null) {
            throw new InvalidSettingsException("Save format must be specified");
        }
        if (saveFormat.isQualityRequired()) {
            if (quality == null) {
                throw new InvalidSettingsException(saveFormat + " output requires a quality between 1 and 100");
            }
            if (quality < 1 || quality > 100) {
                throw new InvalidSettingsException(saveFormat + " quality must be between 1 and 100, got " + quality);
            }
        } else if (quality != null) {
            throw new InvalidSettingsException(saveFormat + " output is lossless and takes no quality");
        }
        if (borderColor == null) {
            throw new InvalidSettingsException("Border color must be specified");
        }
    }

    /**
     * Settings with a fixed border, the common case.
     */
    public static Settings of(String baseFilename, AspectRatio aspectRatio, int borderSize,
                              SaveFormat saveFormat, Integer quality,
                              boolean preserveMetadata, BorderColor borderColor) {
        return new Settings(baseFilename, aspectRatio, borderSize, BorderMode.FIXED,
            saveFormat, quality, preserveMetadata, borderColor);
    }

    public Optional<String> baseFilenameIfPresent() {
        return Optional.ofNullable(baseFilename);
    }

    public Optional<AspectRatio> aspectRatioIfPresent() {
        return Optional.ofNullable(aspectRatio);
    }

    /**
     * Border in pixels for an image of the given size.
     */
    public int borderFor(int imageWidth, int imageHeight) {
        return DimensionPlanner.resolveBorder(borderMode, borderSize, imageWidth, imageHeight);
    }
}
