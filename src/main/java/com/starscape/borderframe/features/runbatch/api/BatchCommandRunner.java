package com.starscape.borderframe.features.runbatch.api;

import com.starscape.borderframe.common.config.ProcessingProperties;
import com.starscape.borderframe.common.exception.InvalidSettingsException;
import com.starscape.borderframe.features.batch.app.BatchExecutor;
import com.starscape.borderframe.features.batch.domain.BatchOutcome;
import com.starscape.borderframe.features.batch.domain.CancellationToken;
import com.starscape.borderframe.features.batch.domain.Settings;
import com.starscape.borderframe.features.discover.app.SourceDiscovery;
import com.starscape.borderframe.features.runbatch.app.LoggingBatchListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 * <pre>
 * borderframe [--output=DIR] [--app.processing.*=...] FILE_OR_FOLDER...
 * </pre>
 *
 * Without {@code --output} results are written next to the first source.
 * The outcome of the last run stays available through {@link #getLastOutcome()}.
 */
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchCommandRunner.class);

    static final String OUTPUT_OPTION = "output";

    private final SourceDiscovery sourceDiscovery;
    private final ProcessingProperties processingProperties;
    private final BatchExecutor batchExecutor;

    private BatchOutcome lastOutcome;

    public BatchCommandRunner(
            SourceDiscovery sourceDiscovery,
            ProcessingProperties processingProperties,
            BatchExecutor batchExecutor) {
        this.sourceDiscovery = sourceDiscovery;
        this.processingProperties = processingProperties;
        this.batchExecutor = batchExecutor;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> selection = args.getNonOptionArgs();
        if (selection.isEmpty()) {
            log.info("No images selected. Usage: borderframe [--output=DIR] FILE_OR_FOLDER...");
            return;
        }

        List<Path> sources = sourceDiscovery.discover(selection.stream().map(Path::of).toList());
        if (sources.isEmpty()) {
            log.warn("No supported images found in {}", selection);
            return;
        }

        Settings settings;
        try {
            settings = processingProperties.toSettings(sources);
        } catch (InvalidSettingsException e) {
            log.error("Invalid settings: {}", e.getMessage());
            return;
        }

        Path outputDir = resolveOutputDir(args, sources);
        Files.createDirectories(outputDir);

        lastOutcome = batchExecutor.run(sources, outputDir, settings,
            new CancellationToken(), new LoggingBatchListener(sources.size()));
        log.info("Batch {}: {} of {} images written to {}",
            lastOutcome.status(), lastOutcome.succeededCount(), lastOutcome.totalCount(), outputDir);
    }

    public BatchOutcome getLastOutcome() {
        return lastOutcome;
    }

    private Path resolveOutputDir(ApplicationArguments args, List<Path> sources) {
        List<String> values = args.getOptionValues(OUTPUT_OPTION);
        if (values != null && !values.isEmpty() && !values.get(0).isBlank()) {
            return Path.of(values.get(0)).toAbsolutePath().normalize();
        }
        Path parent = sources.get(0).getParent();
        return parent != null ? parent : Path.of("").toAbsolutePath();
    }
}
