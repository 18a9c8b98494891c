package com.bbthechange.tvguide.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * A Twitch account on the now-live roster, keyed by its Twitch user id.
 *
 * When {@code live} is false, {@code broadcast} and {@code nextMediaRefreshAt} are null.
 * When {@code live} is true, {@code broadcast} is set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackedStreamer {

    private String id;                  // Twitch user id
    private String login;               // Case-insensitive alternate key
    private String displayName;
    private String profileImageUrl;
    private boolean live;
    private Instant lastOnline;
    private Instant nextMediaRefreshAt;
    private BroadcastMetadata broadcast;

    // Default constructor for Jackson
    public TrackedStreamer() {
    }

    /**
     * Create an offline streamer from profile data.
     */
    public TrackedStreamer(String id, String login, String displayName, String profileImageUrl) {
        this.id = id;
        this.login = login;
        this.displayName = displayName;
        this.profileImageUrl = profileImageUrl;
        this.live = false;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getLogin() {
        return login;
    }

    public void setLogin(String login) {
        this.login = login;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getProfileImageUrl() {
        return profileImageUrl;
    }

    public void setProfileImageUrl(String profileImageUrl) {
        this.profileImageUrl = profileImageUrl;
    }

    public boolean isLive() {
        return live;
    }

    public void setLive(boolean live) {
        this.live = live;
    }

    public Instant getLastOnline() {
        return lastOnline;
    }

    public void setLastOnline(Instant lastOnline) {
        this.lastOnline = lastOnline;
    }

    public Instant getNextMediaRefreshAt() {
        return nextMediaRefreshAt;
    }

    public void setNextMediaRefreshAt(Instant nextMediaRefreshAt) {
        this.nextMediaRefreshAt = nextMediaRefreshAt;
    }

    public BroadcastMetadata getBroadcast() {
        return broadcast;
    }

    public void setBroadcast(BroadcastMetadata broadcast) {
        this.broadcast = broadcast;
    }

    /**
     * Case-insensitive comparison against the login name.
     */
    public boolean hasLogin(String candidate) {
        return login != null && login.equalsIgnoreCase(candidate);
    }

    @Override
    public String toString() {
        return "TrackedStreamer{" +
                "id='" + id + '\'' +
                ", login='" + login + '\'' +
                ", live=" + live +
                '}';
    }
}
