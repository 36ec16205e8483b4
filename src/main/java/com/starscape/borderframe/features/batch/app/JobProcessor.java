package com.starscape.borderframe.features.batch.app;

import com.starscape.borderframe.features.batch.domain.CancellationToken;
import com.starscape.borderframe.features.batch.domain.Job;
import com.starscape.borderframe.features.batch.domain.JobResult;
import com.starscape.borderframe.features.batch.domain.Settings;

import java.nio.file.Path;

/**
 * Runs the full pipeline for one image.
 * Implementations report failures through the returned result and do not throw.
 */
@FunctionalInterface
public interface JobProcessor {

    JobResult process(Job job, Settings settings, Path outputDir, CancellationToken cancellation);
}
