package com.starscape.borderframe.features.batch.app;

import java.util.List;

/**
 * Receives the events of a running batch.
 * All callbacks of one batch are made from its coordinating thread, one at a time:
 * progress events in completion order, then {@code onFinished} exactly once.
 */
public interface BatchListener {

    /**
     * A job finished, whatever its outcome.
     *
     * @param completedCount jobs finished so far, including this one
     * @param statusText     human readable progress line
     */
    default void onProgress(int completedCount, String statusText) {
    }

    /**
     * The batch ended. Fires once, after every progress event.
     *
     * @param errors per-image and batch-level error messages, empty on full success
     */
    default void onFinished(List<String> errors) {
    }

    /**
     * A problem outside the per-image loop, such as a worker pool that could not be started.
     * Always followed by {@link #onFinished(List)}.
     */
    default void onFatalError(String title, String message) {
    }
}
