package com.dcruver.promptloom.domain;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag shared between a caller and a long-running operation.
 * Operations poll it between steps; cancelling never interrupts a database statement mid-flight.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal();

    private volatile boolean cancelled;

    /**
     * A signal that is never cancelled. Calling {@link #cancel()} on it has no effect.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (this != NONE) {
            cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if {@link #cancel()} has been called
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
