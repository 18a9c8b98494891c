package com.bbthechange.tvguide.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Discord message currently showing a live broadcast, keyed by the streamer id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActiveBroadcastMessage {

    private String streamerId;
    private String messageId;
    private String login;
    private String displayName;
    private Instant startedAt;
    private Instant mediaRefreshedAt;   // Cache-buster of the preview image currently shown

    public ActiveBroadcastMessage() {
    }

    public ActiveBroadcastMessage(String streamerId, String messageId, String login, String displayName,
                                  Instant startedAt) {
        this.streamerId = streamerId;
        this.messageId = messageId;
        this.login = login;
        this.displayName = displayName;
        this.startedAt = startedAt;
    }

    public String getStreamerId() {
        return streamerId;
    }

    public void setStreamerId(String streamerId) {
        this.streamerId = streamerId;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
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

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getMediaRefreshedAt() {
        return mediaRefreshedAt;
    }

    public void setMediaRefreshedAt(Instant mediaRefreshedAt) {
        this.mediaRefreshedAt = mediaRefreshedAt;
    }
}
