package com.starscape.borderframe.features.metadata.domain;

import com.drew.lang.GeoLocation;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;

/**
 * A minimal EXIF structure that holds only the GPS information block of a source.
 * The root directory carries nothing but the pointer to the GPS directory.
 *
 * @param exif     the GPS-only EXIF structure, ready to be written
 * @param location decoded coordinates, null when the block has no usable position
 */
public record GpsMetadata(
    TiffOutputSet exif,
    GeoLocation location
) {

    public boolean hasLocation() {
        return location != null && !location.isZero();
    }

    public String describe() {
        return hasLocation() ? location.toDMSString() : "GPS block without position";
    }
}
