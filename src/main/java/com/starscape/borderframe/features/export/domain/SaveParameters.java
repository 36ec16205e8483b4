package com.starscape.borderframe.features.export.domain;

import com.starscape.borderframe.features.metadata.domain.GpsMetadata;

import java.util.Optional;

/**
 * Everything the encoder needs to write one image.
 *
 * @param format            output codec
 * @param quality           1..100 for lossy codecs, null for lossless ones
 * @param chromaSubsampling whether chroma may be subsampled (JPEG only)
 * @param optimize          whether to spend extra effort on a smaller file
 * @param attachMetadata    whether the codec carries the GPS-only block
 * @param iccProfile        color profile copied from the source, may be null
 * @param gps               GPS-only block, may be null
 */
public record SaveParameters(
    SaveFormat format,
    Integer quality,
    boolean chromaSubsampling,
    boolean optimize,
    boolean attachMetadata,
    byte[] iccProfile,
    GpsMetadata gps
) {

    public String extension() {
        return format.getExtension();
    }

    /**
     * Copy with the source's color profile attached.
     */
    public SaveParameters withIccProfile(byte[] profile) {
        return new SaveParameters(format, quality, chromaSubsampling, optimize, attachMetadata, profile, gps);
    }

    /**
     * Copy with the GPS-only block attached. Ignored for codecs that carry no metadata.
     */
    public SaveParameters withGps(GpsMetadata metadata) {
        if (!attachMetadata) {
            return this;
        }
        return new SaveParameters(format, quality, chromaSubsampling, optimize, attachMetadata, iccProfile, metadata);
    }

    public Optional<byte[]> iccProfileIfPresent() {
        return Optional.ofNullable(iccProfile);
    }

    public Optional<GpsMetadata> gpsIfPresent() {
        return Optional.ofNullable(gps);
    }
}
