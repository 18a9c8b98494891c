package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.dto.twitch.TwitchUser;
import com.bbthechange.tvguide.util.CancellationSignal;

import java.util.Optional;

/**
 * Resolves a Twitch login name to its user profile.
 */
public interface StreamerLookup {

    Optional<TwitchUser> findByLogin(String login, CancellationSignal cancellation);
}
