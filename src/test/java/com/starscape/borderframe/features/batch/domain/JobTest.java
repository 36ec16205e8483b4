package com.starscape.borderframe.features.batch.domain;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    @Test
    void shouldNumberOutputsWithPrefix() {
        Path source = Path.of("/photos/IMG_0001.JPG");

        assertEquals("trip_1", new Job(source, 0, 3).outputBaseName("trip"));
        assertEquals("trip_2", new Job(source, 1, 3).outputBaseName("trip"));
        assertEquals("trip_3", new Job(source, 2, 3).outputBaseName("trip"));
    }

    @Test
    void shouldUsePlainPrefixForSingleImage() {
        assertEquals("trip", new Job(Path.of("a.png"), 0, 1).outputBaseName("trip"));
    }

    @Test
    void shouldDeriveNameFromSourceWithoutPrefix() {
        assertEquals("IMG_0001_processed", new Job(Path.of("/photos/IMG_0001.JPG"), 0, 2).outputBaseName(null));
        assertEquals("archive.tar_processed", new Job(Path.of("archive.tar.png"), 0, 1).outputBaseName(""));
        assertEquals(".hidden_processed", new Job(Path.of(".hidden"), 0, 1).outputBaseName(null));
        assertEquals("noext", Job.stem("noext"));
    }

    @Test
    void shouldRejectIndexOutsideBatch() {
        assertThrows(IllegalArgumentException.class, () -> new Job(Path.of("a.png"), 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Job(Path.of("a.png"), -1, 3));
        assertThrows(IllegalArgumentException.class, () -> new Job(null, 0, 1));
    }

    @Test
    void shouldDeriveBatchStatus() {
        assertEquals(BatchStatus.COMPLETED, new BatchOutcome(List.of(), 2, 2, 2, false).status());
        assertEquals(BatchStatus.COMPLETED_WITH_ERRORS,
            new BatchOutcome(List.of("Error processing b.png: boom"), 2, 1, 2, false).status());
        assertEquals(BatchStatus.FAILED, new BatchOutcome(List.of("x", "y"), 2, 0, 2, false).status());
        assertEquals(BatchStatus.CANCELLED, new BatchOutcome(List.of(), 1, 1, 2, true).status());
    }
}
