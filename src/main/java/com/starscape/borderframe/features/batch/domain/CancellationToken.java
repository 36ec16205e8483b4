package com.starscape.borderframe.features.batch.domain;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared stop flag for a batch. Moves from "running" to "cancelled" once and never back.
 * The submission loop and every job read it; nothing is interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Request cancellation.
     *
     * @return true if this call set the flag, false if it was already set
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
