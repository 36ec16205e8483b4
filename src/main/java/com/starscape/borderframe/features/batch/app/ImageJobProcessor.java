package com.starscape.borderframe.features.batch.app;

import com.starscape.borderframe.features.batch.domain.CancellationToken;
import com.starscape.borderframe.features.batch.domain.Job;
import com.starscape.borderframe.features.batch.domain.JobResult;
import com.starscape.borderframe.features.batch.domain.Settings;
import com.starscape.borderframe.features.composite.app.Compositor;
import com.starscape.borderframe.features.composite.infra.ColorProfileReader;
import com.starscape.borderframe.features.export.domain.FormatPolicy;
import com.starscape.borderframe.features.export.domain.SaveParameters;
import com.starscape.borderframe.features.export.infra.ImageEncoder;
import com.starscape.borderframe.features.metadata.app.MetadataPreserver;
import com.starscape.borderframe.features.metadata.domain.GpsMetadata;
import com.starscape.borderframe.features.planframe.domain.CanvasSize;
import com.starscape.borderframe.features.planframe.domain.DimensionPlanner;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Processes a single source image:
 * - Decodes the source and reads its color profile
 * - Plans the canvas and composites border and padding
 * - Keeps the GPS block when requested
 * - Encodes with the selected codec and writes the output file
 *
 * Any failure becomes a FAILED result naming the source; nothing is thrown.
 */
@Service
public class ImageJobProcessor implements JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(ImageJobProcessor.class);

    private final Compositor compositor;
    private final ColorProfileReader colorProfileReader;
    private final MetadataPreserver metadataPreserver;
    private final ImageEncoder imageEncoder;

    public ImageJobProcessor(
            Compositor compositor,
            ColorProfileReader colorProfileReader,
            MetadataPreserver metadataPreserver,
            ImageEncoder imageEncoder) {
        this.compositor = compositor;
        this.colorProfileReader = colorProfileReader;
        this.metadataPreserver = metadataPreserver;
        this.imageEncoder = imageEncoder;
    }

    @Override
    public JobResult process(Job job, Settings settings, Path outputDir, CancellationToken cancellation) {
        try {
            if (cancellation.isCancelled()) {
                log.debug("Skipping {}: batch cancelled", job.sourceName());
                return JobResult.cancelled(job);
            }

            Path source = job.sourcePath();
            BufferedImage image = decode(source);
            int width = image.getWidth();
            int height = image.getHeight();
            Optional<byte[]> iccProfile = colorProfileReader.read(source);

            int border = settings.borderFor(width, height);
            CanvasSize canvas = DimensionPlanner.plan(width, height, border, settings.aspectRatio());
            log.debug("Planned {} canvas for {} ({}x{}, border={})",
                canvas, job.sourceName(), width, height, border);

            // Last checkpoint before the expensive part
            if (cancellation.isCancelled()) {
                log.debug("Skipping {}: batch cancelled", job.sourceName());
                return JobResult.cancelled(job);
            }

            BufferedImage framed = compositor.composite(image, border, canvas, settings.borderColor());

            Optional<GpsMetadata> gps = settings.preserveMetadata()
                ? metadataPreserver.extractGps(source)
                : Optional.empty();

            SaveParameters parameters = FormatPolicy.parametersFor(settings.saveFormat(), settings.quality())
                .withIccProfile(iccProfile.orElse(null))
                .withGps(gps.orElse(null));

            Path outputPath = outputDir.resolve(job.outputBaseName(settings.baseFilename()) + parameters.extension());
            byte[] encoded = imageEncoder.encode(framed, parameters);
            Files.write(outputPath, encoded);

            String checksum = DigestUtils.sha256Hex(encoded);
            log.info("Processed {} -> {} ({}, {} bytes, sha256={})",
                job.sourceName(), outputPath.getFileName(), canvas, encoded.length, checksum);
            return JobResult.completed(job, outputPath, checksum);

        } catch (Exception e) {
            log.error("Failed to process image: {}", job.sourcePath(), e);
            return JobResult.failed(job, "Error processing " + job.sourceName() + ": " + describe(e));
        }
    }

    private BufferedImage decode(Path source) throws IOException {
        BufferedImage image = ImageIO.read(source.toFile());
        if (image == null) {
            throw new IOException("Unsupported or unreadable image format");
        }
        return image;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
