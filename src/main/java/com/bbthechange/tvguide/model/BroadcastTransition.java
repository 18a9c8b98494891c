package com.bbthechange.tvguide.model;

/**
 * Outcome of comparing a streamer's known state with what the status source reported.
 * Declaration order is the order in which buckets are dispatched.
 */
public enum BroadcastTransition {
    DETECTED_LIVE("detected_live"),
    ENDED("ended"),
    CONTINUING("continuing"),
    MEDIA_REFRESH_DUE("media_refresh_due");

    private final String metricTag;

    BroadcastTransition(String metricTag) {
        this.metricTag = metricTag;
    }

    public String getMetricTag() {
        return metricTag;
    }
}
