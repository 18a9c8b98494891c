package com.bbthechange.tvguide.listener;

import com.bbthechange.tvguide.dto.event.ServiceLifecycleEvent;
import com.bbthechange.tvguide.dto.event.StreamerBatchEvent;
import com.bbthechange.tvguide.dto.event.StreamerErrorEvent;

/**
 * Observer of the now-live poller.
 *
 * Batch callbacks fire at most once per bucket per batch, after every streamer in the batch has been
 * classified, and always in the order detected-live, ended, continuing, media-refresh-due.
 * Implementations override only what they need. Callbacks run on the polling thread and should
 * honour the event's cancellation signal for long work.
 */
public interface BroadcastStateListener {

    default void onServiceStarted(ServiceLifecycleEvent event) {
    }

    default void onServiceStarting(ServiceLifecycleEvent event) {
    }

    default void onServiceExiting(ServiceLifecycleEvent event) {
    }

    default void onServiceExited(ServiceLifecycleEvent event) {
    }

    /**
     * Streamers that were offline and are now live. Their broadcast is set.
     */
    default void onStreamersDetectedLive(StreamerBatchEvent event) {
    }

    /**
     * Streamers that were live and are now offline. The broadcast is still present during this call
     * and is cleared once every listener has returned.
     */
    default void onStreamersEnded(StreamerBatchEvent event) {
    }

    /**
     * Streamers still live whose media refresh deadline has not passed.
     */
    default void onStreamersContinuing(StreamerBatchEvent event) {
    }

    /**
     * Streamers still live whose media refresh deadline has passed. The deadline has been re-armed.
     */
    default void onStreamersMediaRefreshDue(StreamerBatchEvent event) {
    }

    default void onStreamerAdded(StreamerBatchEvent event) {
    }

    default void onStreamerRemoved(StreamerBatchEvent event) {
    }

    default void onStreamerError(StreamerErrorEvent event) {
    }
}
