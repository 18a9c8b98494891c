package com.bbthechange.tvguide.repository;

import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.util.CancellationSignal;

import java.util.List;

/**
 * Durable copy of the tracked-streamer roster.
 */
public interface RosterRepository {

    /**
     * Load the persisted roster. An absent or unreadable store yields an empty list.
     */
    List<TrackedStreamer> loadRoster(CancellationSignal cancellation);

    /**
     * Replace the persisted roster with the given streamers.
     *
     * @throws com.bbthechange.tvguide.exception.RepositoryException if the roster could not be written
     */
    void saveRoster(List<TrackedStreamer> streamers, CancellationSignal cancellation);
}
