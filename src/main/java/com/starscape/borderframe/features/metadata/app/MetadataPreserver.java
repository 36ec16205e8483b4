package com.starscape.borderframe.features.metadata.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.GpsDirectory;
import com.starscape.borderframe.features.metadata.domain.GpsMetadata;
import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.ImageWriteException;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.ImagingException;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputDirectory;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Keeps the GPS location of a photo and nothing else.
 * <p>
 * Camera make and model, timestamps, orientation, thumbnails and every other tag
 * are dropped. A source without GPS data, or with metadata that cannot be parsed,
 * simply yields no metadata; that is a normal outcome and never fails a job.
 */
@Component
public class MetadataPreserver {

    private static final Logger log = LoggerFactory.getLogger(MetadataPreserver.class);

    /**
     * Build a GPS-only EXIF block from the source's metadata.
     *
     * @param source the source image file
     * @return the GPS-only block, or empty when there is nothing to keep
     */
    public Optional<GpsMetadata> extractGps(Path source) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(source.toFile());
            GpsDirectory gpsDirectory = metadata.getFirstDirectoryOfType(GpsDirectory.class);
            if (gpsDirectory == null || gpsDirectory.getTagCount() == 0) {
                log.debug("No GPS block in {}", source.getFileName());
                return Optional.empty();
            }

            TiffImageMetadata exif = readExif(source);
            if (exif == null) {
                return Optional.empty();
            }
            TiffOutputSet original = exif.getOutputSet();
            TiffOutputDirectory gps = original.getGPSDirectory();
            if (gps == null) {
                return Optional.empty();
            }

            TiffOutputSet gpsOnly = new TiffOutputSet(original.byteOrder);
            gpsOnly.getOrCreateRootDirectory();
            gpsOnly.addDirectory(gps);

            GpsMetadata result = new GpsMetadata(gpsOnly, gpsDirectory.getGeoLocation());
            log.debug("Keeping GPS block of {}: {}", source.getFileName(), result.describe());
            return Optional.of(result);

        } catch (ImageProcessingException | ImagingException | IOException | RuntimeException e) {
            // Unreadable metadata means "nothing to attach"
            log.debug("Skipping metadata of {}: {}", source.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Write the GPS-only block into an encoded JPEG, replacing any EXIF it already has.
     *
     * @param jpeg encoded JPEG bytes
     * @param gps  the block to attach
     * @return the JPEG with the block inserted; scan data is left untouched
     */
    public byte[] attachToJpeg(byte[] jpeg, GpsMetadata gps) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream(jpeg.length + 1024);
        try {
            new ExifRewriter().updateExifMetadataLossless(jpeg, output, gps.exif());
        } catch (ImageReadException | ImageWriteException e) {
            throw new IOException("Failed to write GPS metadata: " + e.getMessage(), e);
        }
        return output.toByteArray();
    }

    private TiffImageMetadata readExif(Path source) throws ImageReadException, IOException {
        ImageMetadata metadata = Imaging.getMetadata(source.toFile());
        if (metadata instanceof JpegImageMetadata jpegMetadata) {
            return jpegMetadata.getExif();
        }
        if (metadata instanceof TiffImageMetadata tiffMetadata) {
            return tiffMetadata;
        }
        return null;
    }
}
