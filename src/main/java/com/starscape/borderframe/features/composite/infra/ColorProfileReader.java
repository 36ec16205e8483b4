package com.starscape.borderframe.features.composite.infra;

import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import com.drew.imaging.ImageProcessingException;
import com.drew.imaging.jpeg.JpegSegmentData;
import com.drew.imaging.jpeg.JpegSegmentReader;
import com.drew.imaging.jpeg.JpegSegmentType;
import com.drew.imaging.png.PngChunk;
import com.drew.imaging.png.PngChunkReader;
import com.drew.imaging.png.PngChunkType;
import com.drew.lang.StreamReader;
import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.Imaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Optional;
import java.util.TreeMap;
import java.util.zip.InflaterInputStream;

/**
 * Reads the embedded ICC color profile of a source file as raw bytes.
 * The blob is handed to the encoder untouched; it is never parsed or rebuilt.
 */
@Component
public class ColorProfileReader {

    private static final Logger log = LoggerFactory.getLogger(ColorProfileReader.class);

    static final byte[] JPEG_ICC_IDENTIFIER = "ICC_PROFILE\0".getBytes(StandardCharsets.US_ASCII);
    // identifier + sequence number + chunk count
    static final int JPEG_ICC_HEADER_LENGTH = JPEG_ICC_IDENTIFIER.length + 2;

    /**
     * Find the ICC profile of the source.
     *
     * @param source the source file
     * @return the profile bytes exactly as stored in the file, or empty when the source has none
     *         or its container cannot be read
     */
    public Optional<byte[]> read(Path source) {
        try {
            FileType fileType;
            try (BufferedInputStream in = new BufferedInputStream(Files.newInputStream(source))) {
                fileType = FileTypeDetector.detectFileType(in);
            }
            Optional<byte[]> profile = switch (fileType) {
                case Jpeg -> readJpegProfile(source);
                case Png -> readPngProfile(source);
                default -> readOtherProfile(source);
            };
            profile.ifPresent(bytes ->
                log.debug("Found {} byte ICC profile in {}", bytes.length, source.getFileName()));
            return profile;
        } catch (IOException | ImageProcessingException | ImageReadException e) {
            log.debug("Could not read ICC profile from {}: {}", source.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<byte[]> readJpegProfile(Path source) throws IOException, ImageProcessingException {
        JpegSegmentData segments = JpegSegmentReader.readSegments(
            source.toFile(), Collections.singletonList(JpegSegmentType.APP2));

        // Profiles larger than one segment are split into numbered chunks
        TreeMap<Integer, byte[]> chunks = new TreeMap<>();
        for (byte[] segment : segments.getSegments(JpegSegmentType.APP2)) {
            if (segment.length > JPEG_ICC_HEADER_LENGTH && startsWith(segment, JPEG_ICC_IDENTIFIER)) {
                int sequence = segment[JPEG_ICC_IDENTIFIER.length] & 0xFF;
                byte[] chunk = new byte[segment.length - JPEG_ICC_HEADER_LENGTH];
                System.arraycopy(segment, JPEG_ICC_HEADER_LENGTH, chunk, 0, chunk.length);
                chunks.put(sequence, chunk);
            }
        }
        if (chunks.isEmpty()) {
            return Optional.empty();
        }
        ByteArrayOutputStream profile = new ByteArrayOutputStream();
        for (byte[] chunk : chunks.values()) {
            profile.write(chunk);
        }
        return Optional.of(profile.toByteArray());
    }

    private Optional<byte[]> readPngProfile(Path source) throws IOException, ImageProcessingException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(source))) {
            Iterable<PngChunk> chunks = new PngChunkReader().extract(
                new StreamReader(in), Collections.singleton(PngChunkType.iCCP));
            for (PngChunk chunk : chunks) {
                if (chunk.getType().equals(PngChunkType.iCCP)) {
                    return Optional.of(inflateIccp(chunk.getBytes()));
                }
            }
        }
        return Optional.empty();
    }

    // iCCP layout: profile name, NUL, compression method, zlib stream
    private byte[] inflateIccp(byte[] data) throws IOException {
        int nameEnd = 0;
        while (nameEnd < data.length && data[nameEnd] != 0) {
            nameEnd++;
        }
        int streamStart = nameEnd + 2;
        if (streamStart > data.length) {
            throw new IOException("Truncated iCCP chunk");
        }
        try (InputStream in = new InflaterInputStream(
                new ByteArrayInputStream(data, streamStart, data.length - streamStart))) {
            return in.readAllBytes();
        }
    }

    // TIFF, BMP, GIF and the rest: the stored blob, as commons-imaging finds it in the container
    private Optional<byte[]> readOtherProfile(Path source) throws IOException, ImageReadException {
        return Optional.ofNullable(Imaging.getICCProfileBytes(source.toFile()));
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
