package com.bbthechange.tvguide.dto.event;

import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.util.CancellationSignal;

import java.util.List;

/**
 * A group of streamers delivered in one callback, for example every streamer of a batch that went live.
 */
public record StreamerBatchEvent(
    List<TrackedStreamer> streamers,
    CancellationSignal cancellation
) {
    public StreamerBatchEvent {
        streamers = List.copyOf(streamers);
    }

    public static StreamerBatchEvent of(TrackedStreamer streamer, CancellationSignal cancellation) {
        return new StreamerBatchEvent(List.of(streamer), cancellation);
    }

    public int size() {
        return streamers.size();
    }
}
