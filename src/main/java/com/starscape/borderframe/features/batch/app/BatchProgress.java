package com.starscape.borderframe.features.batch.app;

import com.starscape.borderframe.features.batch.domain.BatchOutcome;
import com.starscape.borderframe.features.batch.domain.JobResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates job results of one batch into counts and an ordered error list.
 * Each recorded result yields a consistent (count, text) snapshot.
 */
class BatchProgress {

    private final int totalCount;
    private final List<String> errors = new ArrayList<>();
    private int completedCount;
    private int succeededCount;

    BatchProgress(int totalCount) {
        this.totalCount = totalCount;
    }

    synchronized Snapshot record(JobResult result) {
        completedCount++;
        if (result.isSuccess()) {
            succeededCount++;
        } else if (result.isFailure()) {
            errors.add(result.errorMessage());
        }
        return new Snapshot(completedCount, "Processed " + completedCount + " of " + totalCount + " images");
    }

    /**
     * A job that ended without producing a result still counts as completed and failed.
     */
    synchronized Snapshot recordUnexpected(String message) {
        completedCount++;
        errors.add(message);
        return new Snapshot(completedCount, "Processed " + completedCount + " of " + totalCount + " images");
    }

    synchronized void recordBatchError(String message) {
        errors.add(message);
    }

    synchronized BatchOutcome toOutcome(boolean cancelled) {
        return new BatchOutcome(errors, completedCount, succeededCount, totalCount, cancelled);
    }

    record Snapshot(int completedCount, String statusText) {
    }
}
