package com.starscape.borderframe.common.config;

import com.starscape.borderframe.common.exception.InvalidSettingsException;
import com.starscape.borderframe.features.batch.domain.Settings;
import com.starscape.borderframe.features.composite.domain.BorderColor;
import com.starscape.borderframe.features.export.domain.FormatPolicy;
import com.starscape.borderframe.features.export.domain.FormatPreset;
import com.starscape.borderframe.features.export.domain.SaveFormat;
import com.starscape.borderframe.features.planframe.domain.AspectRatio;
import com.starscape.borderframe.features.planframe.domain.BorderMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Configuration properties for batch processing.
 * Binds to app.processing.* properties from application.yml
 */
@Validated
@ConfigurationProperties(prefix = "app.processing")
public class ProcessingProperties {

    private String baseFilename;
    private String aspectRatio = "original";
    @PositiveOrZero
    private int borderSize;
    @NotNull
    private BorderMode borderMode = BorderMode.FIXED;
    private String borderColor = "#FFFFFF";
    private SaveFormat saveFormat;
    @Min(1)
    @Max(100)
    private Integer quality;
    private boolean preserveMetadata = true;
    @PositiveOrZero
    private int maxWorkers;
    private List<String> supportedExtensions = List.of(
            "jpg", "jpeg", "png", "bmp", "gif", "tif", "tiff", "heif", "heic");

    public String getBaseFilename() {
        return baseFilename;
    }

    public void setBaseFilename(String baseFilename) {
        this.baseFilename = baseFilename;
    }

    public String getAspectRatio() {
        return aspectRatio;
    }

    public void setAspectRatio(String aspectRatio) {
        this.aspectRatio = aspectRatio;
    }

    public int getBorderSize() {
        return borderSize;
    }

    public void setBorderSize(int borderSize) {
        this.borderSize = borderSize;
    }

    public BorderMode getBorderMode() {
        return borderMode;
    }

    public void setBorderMode(BorderMode borderMode) {
        this.borderMode = borderMode;
    }

    public String getBorderColor() {
        return borderColor;
    }

    public void setBorderColor(String borderColor) {
        this.borderColor = borderColor;
    }

    public SaveFormat getSaveFormat() {
        return saveFormat;
    }

    public void setSaveFormat(SaveFormat saveFormat) {
        this.saveFormat = saveFormat;
    }

    public Integer getQuality() {
        return quality;
    }

    public void setQuality(Integer quality) {
        this.quality = quality;
    }

    public boolean isPreserveMetadata() {
        return preserveMetadata;
    }

    public void setPreserveMetadata(boolean preserveMetadata) {
        this.preserveMetadata = preserveMetadata;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public List<String> getSupportedExtensions() {
        return supportedExtensions;
    }

    public void setSupportedExtensions(List<String> supportedExtensions) {
        this.supportedExtensions = supportedExtensions;
    }

    /**
     * Check if a file has one of the supported extensions.
     * Performs case-insensitive comparison; a leading dot in the configured list is ignored.
     * @param file The file to check
     * @return true if the extension is in the supported extensions list
     */
    public boolean isSupportedExtension(Path file) {
        if (file == null || file.getFileName() == null
                || supportedExtensions == null || supportedExtensions.isEmpty()) {
            return false;
        }
        String name = file.getFileName().toString();
        int lastDot = name.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == name.length() - 1) {
            return false;
        }
        String extension = name.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        return supportedExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT).trim())
                .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                .anyMatch(ext -> ext.equals(extension));
    }

    /**
     * Build validated batch settings from these properties.
     * Without a configured save format the format suggested for the sources is used,
     * together with its quality when no quality is configured.
     * @param sources The images the batch will process
     * @return the settings for the batch
     * @throws InvalidSettingsException if the properties do not form valid settings
     */
    public Settings toSettings(List<Path> sources) {
        SaveFormat format = saveFormat;
        Integer effectiveQuality = quality;
        if (format == null) {
            FormatPreset preset = FormatPolicy.suggestFor(sources)
                .orElseThrow(() -> new InvalidSettingsException(
                    "No save format configured and none can be suggested for the selected images"));
            format = preset.getFormat();
            if (effectiveQuality == null) {
                effectiveQuality = preset.getQuality();
            }
        }
        if (format.isLossless()) {
            effectiveQuality = null;
        }

        return new Settings(
            baseFilename,
            AspectRatio.parse(aspectRatio).orElse(null),
            borderSize,
            borderMode,
            format,
            effectiveQuality,
            preserveMetadata,
            borderColor == null || borderColor.isBlank() ? BorderColor.WHITE : BorderColor.parse(borderColor));
    }
}
