package com.bbthechange.tvguide.dto.event;

import com.bbthechange.tvguide.util.CancellationSignal;

import java.time.Instant;

/**
 * Poller lifecycle notification.
 */
public record ServiceLifecycleEvent(
    Phase phase,
    Instant occurredAt,
    CancellationSignal cancellation
) {
    public enum Phase {
        STARTED,
        STARTING,
        EXITING,
        EXITED
    }
}
