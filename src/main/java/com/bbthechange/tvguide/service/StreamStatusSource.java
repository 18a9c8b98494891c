package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.dto.twitch.TwitchStream;
import com.bbthechange.tvguide.util.CancellationSignal;

import java.util.List;

/**
 * Reports which of a set of streamers are currently broadcasting.
 */
public interface StreamStatusSource {

    /**
     * Query the live streams for the given user ids.
     * Offline users are simply absent from the result.
     *
     * @param userIds at most 100 Twitch user ids
     * @return the live streams among the given users, in no particular order
     */
    List<TwitchStream> getLiveStreams(List<String> userIds, CancellationSignal cancellation);
}
