package com.bbthechange.tvguide.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted display state: the summary message and one message per live streamer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActiveBroadcasts {

    private String summaryMessageId;
    private List<ActiveBroadcastMessage> messages = new ArrayList<>();

    public String getSummaryMessageId() {
        return summaryMessageId;
    }

    public void setSummaryMessageId(String summaryMessageId) {
        this.summaryMessageId = summaryMessageId;
    }

    public List<ActiveBroadcastMessage> getMessages() {
        return messages;
    }

    public void setMessages(List<ActiveBroadcastMessage> messages) {
        this.messages = messages != null ? messages : new ArrayList<>();
    }
}
