package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.listener.BroadcastStateListener;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.util.CancellationSignal;

import java.util.List;

/**
 * Tracks a roster of Twitch streamers and reconciles their known broadcast state with what Twitch reports.
 */
public interface NowLiveService {

    /**
     * Resolve the login and start tracking it.
     *
     * @return SUCCESS, NOT_FOUND if Twitch does not know the login, or ALREADY_EXISTS if it is already tracked
     */
    StreamerManagementResult addStreamer(String login, CancellationSignal cancellation);

    /**
     * Stop tracking the streamer with the given login, compared ignoring case.
     *
     * @return SUCCESS, NOT_FOUND if no tracked streamer has the login, or ERROR if it vanished concurrently
     */
    StreamerManagementResult removeStreamer(String login, CancellationSignal cancellation);

    /**
     * Poll every tracked streamer once, notify listeners of transitions, then persist the roster.
     *
     * @throws java.util.concurrent.CancellationException if cancelled between batches
     * @throws com.bbthechange.tvguide.exception.RepositoryException if the roster could not be saved
     */
    void tick(CancellationSignal cancellation);

    void loadRoster(CancellationSignal cancellation);

    void saveRoster(CancellationSignal cancellation);

    /**
     * Snapshot of the tracked streamers.
     */
    List<TrackedStreamer> getTrackedStreamers();

    void registerListener(BroadcastStateListener listener);

    void unregisterListener(BroadcastStateListener listener);

    void notifyServiceStarted();

    void notifyServiceStarting(CancellationSignal cancellation);

    void notifyServiceExiting(CancellationSignal cancellation);

    void notifyServiceExited();
}
