package com.starscape.borderframe.features.export.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * The codec and quality combinations offered for selection.
 */
public enum FormatPreset {
    JPEG_80("JPEG (80% quality)", SaveFormat.JPEG, 80),
    JPEG_95("JPEG (95% quality)", SaveFormat.JPEG, 95),
    JPEG_100("JPEG (100% quality)", SaveFormat.JPEG, 100),
    TIFF("TIFF", SaveFormat.TIFF, null),
    PNG("PNG", SaveFormat.PNG, null),
    HEIF_80("HEIF (80% quality)", SaveFormat.HEIF, 80),
    HEIF_95("HEIF (95% quality)", SaveFormat.HEIF, 95),
    HEIF_100("HEIF (100% quality)", SaveFormat.HEIF, 100);

    private final String label;
    private final SaveFormat format;
    private final Integer quality;

    FormatPreset(String label, SaveFormat format, Integer quality) {
        this.label = label;
        this.format = format;
        this.quality = quality;
    }

    public String getLabel() {
        return label;
    }

    public SaveFormat getFormat() {
        return format;
    }

    public Integer getQuality() {
        return quality;
    }

    public static Optional<FormatPreset> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(preset -> preset.label.equals(label))
            .findFirst();
    }
}
