package com.starscape.borderframe.features.batch.domain;

import java.util.List;

/**
 * Terminal result of a batch.
 *
 * @param errors         error messages in completion order, empty on full success
 * @param completedCount jobs that reported a result, whatever their status
 * @param succeededCount jobs that wrote an output file
 * @param totalCount     sources handed to the batch
 * @param cancelled      whether cancellation was requested before the batch ended
 */
public record BatchOutcome(
    List<String> errors,
    int completedCount,
    int succeededCount,
    int totalCount,
    boolean cancelled
) {

    public BatchOutcome {
        errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty() && !cancelled && completedCount == totalCount;
    }

    public int failedCount() {
        return errors.size();
    }

    public BatchStatus status() {
        if (cancelled) {
            return BatchStatus.CANCELLED;
        }
        if (errors.isEmpty() && succeededCount == totalCount) {
            return BatchStatus.COMPLETED;
        }
        return succeededCount > 0 ? BatchStatus.COMPLETED_WITH_ERRORS : BatchStatus.FAILED;
    }
}
