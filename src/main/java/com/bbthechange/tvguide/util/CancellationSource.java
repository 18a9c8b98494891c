package com.bbthechange.tvguide.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owner side of a {@link CancellationSignal}. Once cancelled it stays cancelled.
 */
public class CancellationSource implements CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
