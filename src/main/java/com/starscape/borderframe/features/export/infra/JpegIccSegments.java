package com.starscape.borderframe.features.export.infra;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Splices an ICC profile into an encoded JPEG as APP2 segments.
 * The profile bytes are copied verbatim, split into numbered chunks when they
 * exceed the capacity of a single segment.
 */
final class JpegIccSegments {

    private static final byte[] IDENTIFIER = "ICC_PROFILE\0".getBytes(StandardCharsets.US_ASCII);
    private static final int MARKER_PREFIX = 0xFF;
    private static final int SOI = 0xD8;
    private static final int APP0 = 0xE0;
    private static final int APP1 = 0xE1;
    private static final int APP2 = 0xE2;
    // 65535 minus the length field, identifier, sequence number and chunk count
    static final int MAX_CHUNK = 65535 - 2 - IDENTIFIER.length - 2;

    private JpegIccSegments() {
    }

    /**
     * Insert the profile after the leading JFIF and EXIF segments.
     *
     * @throws IOException if the input is not a JPEG or the profile needs more than 255 chunks
     */
    static byte[] insert(byte[] jpeg, byte[] profile) throws IOException {
        if (jpeg.length < 4 || (jpeg[0] & 0xFF) != MARKER_PREFIX || (jpeg[1] & 0xFF) != SOI) {
            throw new IOException("Not a JPEG stream");
        }
        int chunkCount = (profile.length + MAX_CHUNK - 1) / MAX_CHUNK;
        if (chunkCount == 0 || chunkCount > 255) {
            throw new IOException("Cannot embed ICC profile of " + profile.length + " bytes");
        }

        int insertAt = 2;
        while (insertAt + 4 <= jpeg.length
                && (jpeg[insertAt] & 0xFF) == MARKER_PREFIX
                && ((jpeg[insertAt + 1] & 0xFF) == APP0 || (jpeg[insertAt + 1] & 0xFF) == APP1)) {
            int length = ((jpeg[insertAt + 2] & 0xFF) << 8) | (jpeg[insertAt + 3] & 0xFF);
            insertAt += 2 + length;
        }
        if (insertAt > jpeg.length) {
            throw new IOException("Truncated JPEG segment");
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(jpeg.length + profile.length + chunkCount * 18);
        out.write(jpeg, 0, insertAt);
        for (int chunk = 0; chunk < chunkCount; chunk++) {
            int offset = chunk * MAX_CHUNK;
            int size = Math.min(MAX_CHUNK, profile.length - offset);
            int segmentLength = 2 + IDENTIFIER.length + 2 + size;
            out.write(MARKER_PREFIX);
            out.write(APP2);
            out.write(segmentLength >> 8);
            out.write(segmentLength & 0xFF);
            out.write(IDENTIFIER);
            out.write(chunk + 1);
            out.write(chunkCount);
            out.write(profile, offset, size);
        }
        out.write(jpeg, insertAt, jpeg.length - insertAt);
        return out.toByteArray();
    }
}
