package com.starscape.borderframe.features.batch.domain;

import java.nio.file.Path;

/**
 * Outcome of one job. Every submitted job yields exactly one result.
 *
 * @param job          the job this result belongs to
 * @param status       how the job ended
 * @param outputPath   written file, only for COMPLETED
 * @param checksum     SHA-256 hex of the written bytes, only for COMPLETED
 * @param errorMessage description naming the source file, only for FAILED
 */
public record JobResult(
    Job job,
    JobStatus status,
    Path outputPath,
    String checksum,
    String errorMessage
) {

    public static JobResult completed(Job job, Path outputPath, String checksum) {
        return new JobResult(job, JobStatus.COMPLETED, outputPath, checksum, null);
    }

    public static JobResult failed(Job job, String errorMessage) {
        return new JobResult(job, JobStatus.FAILED, null, null, errorMessage);
    }

    public static JobResult cancelled(Job job) {
        return new JobResult(job, JobStatus.CANCELLED, null, null, null);
    }

    public boolean isSuccess() {
        return status == JobStatus.COMPLETED;
    }

    public boolean isFailure() {
        return status == JobStatus.FAILED;
    }
}
