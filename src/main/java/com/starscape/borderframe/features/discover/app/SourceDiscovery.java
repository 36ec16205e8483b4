package com.starscape.borderframe.features.discover.app;

import com.starscape.borderframe.common.config.ProcessingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns the user's selection into the ordered list of source images of a batch.
 * Folders are walked recursively and filtered by the supported extensions;
 * explicitly named files are taken as given, so an unreadable one fails in its own job.
 */
@Component
public class SourceDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SourceDiscovery.class);

    private final ProcessingProperties processingProperties;

    public SourceDiscovery(ProcessingProperties processingProperties) {
        this.processingProperties = processingProperties;
    }

    /**
     * Resolve files and folders to source images.
     * Selection order is kept; files found inside one folder are sorted by path.
     * A file selected twice is processed once.
     *
     * @param selection files and folders chosen by the user
     * @return the sources, in batch order
     * @throws NoSuchFileException if a selected path does not exist
     * @throws IOException         if a folder cannot be walked
     */
    public List<Path> discover(List<Path> selection) throws IOException {
        Set<Path> sources = new LinkedHashSet<>();
        for (Path selected : selection) {
            Path path = selected.toAbsolutePath().normalize();
            if (Files.isDirectory(path)) {
                List<Path> found = walk(path);
                log.debug("Found {} supported images under {}", found.size(), path);
                sources.addAll(found);
            } else if (Files.exists(path)) {
                sources.add(path);
            } else {
                throw new NoSuchFileException(path.toString());
            }
        }
        return new ArrayList<>(sources);
    }

    private List<Path> walk(Path folder) throws IOException {
        try (Stream<Path> stream = Files.walk(folder)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(processingProperties::isSupportedExtension)
                .sorted()
                .toList();
        }
    }
}
