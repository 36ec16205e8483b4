package com.starscape.borderframe.features.batch.app;

import com.starscape.borderframe.features.batch.domain.BatchOutcome;
import com.starscape.borderframe.features.batch.domain.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * A batch running in the background.
 */
public final class BatchHandle {

    private final CancellationToken cancellation;
    private final CompletableFuture<BatchOutcome> outcome;

    BatchHandle(CancellationToken cancellation, CompletableFuture<BatchOutcome> outcome) {
        this.cancellation = cancellation;
        this.outcome = outcome;
    }

    /**
     * Stop submitting further images. Images already submitted still finish and report.
     * Calling this more than once has no further effect.
     */
    public void cancel() {
        cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    public CompletableFuture<BatchOutcome> outcome() {
        return outcome;
    }
}
