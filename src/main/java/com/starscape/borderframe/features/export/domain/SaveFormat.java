package com.starscape.borderframe.features.export.domain;

import java.util.List;

/**
 * Output codecs supported by the exporter.
 */
public enum SaveFormat {
    JPEG(".jpg", true, List.of("jpeg", "jpg")),
    PNG(".png", false, List.of("png")),
    TIFF(".tiff", false, List.of("tiff", "tif")),
    HEIF(".heif", true, List.of("heif", "heic"));

    private final String extension;
    private final boolean qualityRequired;
    private final List<String> writerFormatNames;

    SaveFormat(String extension, boolean qualityRequired, List<String> writerFormatNames) {
        this.extension = extension;
        this.qualityRequired = qualityRequired;
        this.writerFormatNames = writerFormatNames;
    }

    /**
     * File extension including the leading dot.
     */
    public String getExtension() {
        return extension;
    }

    public boolean isQualityRequired() {
        return qualityRequired;
    }

    public boolean isLossless() {
        return !qualityRequired;
    }

    /**
     * ImageIO format names tried, in order, when looking up a writer.
     */
    public List<String> getWriterFormatNames() {
        return writerFormatNames;
    }
}
