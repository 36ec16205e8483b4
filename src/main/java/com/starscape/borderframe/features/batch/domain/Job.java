package com.starscape.borderframe.features.batch.domain;

import java.nio.file.Path;

/**
 * One source image of a batch.
 *
 * @param sourcePath image to process
 * @param index      0-based position in the batch
 * @param batchSize  number of sources in the batch
 */
public record Job(
    Path sourcePath,
    int index,
    int batchSize
) {

    public Job {
        if (sourcePath == null) {
            throw new IllegalArgumentException("Source path must not be null");
        }
        if (index < 0 || index >= batchSize) {
            throw new IllegalArgumentException("Index " + index + " outside batch of " + batchSize);
        }
    }

    public String sourceName() {
        Path fileName = sourcePath.getFileName();
        return fileName != null ? fileName.toString() : sourcePath.toString();
    }

    /**
     * Output file name without extension.
     * With a prefix the name is {@code prefix} for a single image and
     * {@code prefix_N} (1-based) otherwise; without one it is
     * {@code <source stem>_processed}. Names are not de-duplicated.
     */
    public String outputBaseName(String baseFilename) {
        if (baseFilename != null && !baseFilename.isBlank()) {
            return batchSize > 1 ? baseFilename + "_" + (index + 1) : baseFilename;
        }
        return stem(sourceName()) + "_processed";
    }

    static String stem(String filename) {
        int lastDot = filename.lastIndexOf('.');
        return lastDot > 0 ? filename.substring(0, lastDot) : filename;
    }
}
