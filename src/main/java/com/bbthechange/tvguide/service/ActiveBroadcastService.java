package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.model.ActiveBroadcastMessage;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.util.CancellationSignal;

import java.util.List;

/**
 * Mirrors live broadcasts into a Discord channel: one message per live streamer plus a summary message.
 */
public interface ActiveBroadcastService {

    /**
     * Restore the tracked messages persisted by a previous run.
     */
    void loadData(CancellationSignal cancellation);

    /**
     * Create or edit the message of each streamer.
     *
     * @param refreshMedia true to make Discord refetch the preview image
     */
    void showLive(List<TrackedStreamer> streamers, boolean refreshMedia, CancellationSignal cancellation);

    /**
     * Turn each streamer's message into its finished form and stop tracking it.
     */
    void showEnded(List<TrackedStreamer> streamers, CancellationSignal cancellation);

    /**
     * Rewrite the summary message, creating it when none is tracked or it was deleted.
     */
    void updateSummary(CancellationSignal cancellation);

    List<ActiveBroadcastMessage> getActiveMessages();
}
