package com.bbthechange.tvguide.dto.event;

import com.bbthechange.tvguide.util.CancellationSignal;

/**
 * A tracked streamer whose state could not be updated during a tick.
 */
public record StreamerErrorEvent(
    String streamerId,
    String message,
    Throwable error,
    CancellationSignal cancellation
) {
}
