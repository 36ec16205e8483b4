package com.starscape.borderframe.features.export.domain;

import com.starscape.borderframe.common.exception.InvalidSettingsException;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a codec selection to its file extension and save parameters.
 * The extension depends only on the selected codec, never on the source file.
 */
public final class FormatPolicy {

    private FormatPolicy() {
    }

    /**
     * Save parameters for a codec and quality.
     *
     * @param format  the output codec
     * @param quality 1..100, required for JPEG and HEIF and ignored for lossless codecs
     * @throws InvalidSettingsException if a lossy codec has no valid quality
     */
    public static SaveParameters parametersFor(SaveFormat format, Integer quality) {
        if (format == null) {
            throw new InvalidSettingsException("Save format must be specified");
        }
        if (format.isQualityRequired()) {
            checkQuality(format, quality);
        }
        return switch (format) {
            // 4:4:4 keeps the border edge crisp; only JPEG carries the GPS block
            case JPEG -> new SaveParameters(format, quality, false, true, true, null, null);
            case PNG -> new SaveParameters(format, null, false, true, false, null, null);
            case TIFF -> new SaveParameters(format, null, false, false, false, null, null);
            case HEIF -> new SaveParameters(format, quality, false, false, false, null, null);
        };
    }

    public static SaveParameters parametersFor(FormatPreset preset) {
        return parametersFor(preset.getFormat(), preset.getQuality());
    }

    /**
     * Suggest a preset from the extensions of the selected sources.
     * A suggestion is made only when every source shares one recognised extension.
     */
    public static Optional<FormatPreset> suggestFor(Collection<Path> sources) {
        if (sources == null || sources.isEmpty()) {
            return Optional.empty();
        }
        Set<String> extensions = sources.stream()
            .map(FormatPolicy::extensionOf)
            .collect(Collectors.toSet());
        if (extensions.size() != 1) {
            return Optional.empty();
        }
        return switch (extensions.iterator().next()) {
            case ".jpg", ".jpeg" -> Optional.of(FormatPreset.JPEG_100);
            case ".png" -> Optional.of(FormatPreset.PNG);
            case ".tif", ".tiff" -> Optional.of(FormatPreset.TIFF);
            case ".heif", ".heic" -> Optional.of(FormatPreset.HEIF_100);
            default -> Optional.empty();
        };
    }

    static void checkQuality(SaveFormat format, Integer quality) {
        if (quality == null) {
            throw new InvalidSettingsException(format + " output requires a quality between 1 and 100");
        }
        if (quality < 1 || quality > 100) {
            throw new InvalidSettingsException(format + " quality must be between 1 and 100, got " + quality);
        }
    }

    private static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot).toLowerCase(Locale.ROOT) : "";
    }
}
