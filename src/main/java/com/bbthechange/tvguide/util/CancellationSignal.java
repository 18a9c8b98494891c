package com.bbthechange.tvguide.util;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag passed down through status queries, notifications and saves.
 * Cancellation is an exit path, not an error: it surfaces as {@link CancellationException}.
 */
@FunctionalInterface
public interface CancellationSignal {

    /**
     * Signal that is never cancelled. Used for the final flush at shutdown.
     */
    CancellationSignal NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Operation was cancelled");
        }
    }
}
