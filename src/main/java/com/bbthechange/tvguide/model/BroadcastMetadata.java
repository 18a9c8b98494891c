package com.bbthechange.tvguide.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Details of the broadcast a tracked streamer is currently running.
 * Present on a {@link TrackedStreamer} only while it is believed to be live.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BroadcastMetadata {

    private String streamId;
    private String title;
    private String categoryId;
    private String categoryName;
    private int viewerCount;
    private Instant startedAt;
    private String thumbnailUrl;

    // Default constructor for Jackson
    public BroadcastMetadata() {
    }

    public BroadcastMetadata(String streamId, String title, String categoryId, String categoryName,
                             int viewerCount, Instant startedAt) {
        this.streamId = streamId;
        this.title = title;
        this.categoryId = categoryId;
        this.categoryName = categoryName;
        this.viewerCount = viewerCount;
        this.startedAt = startedAt;
    }

    public String getStreamId() {
        return streamId;
    }

    public void setStreamId(String streamId) {
        this.streamId = streamId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(String categoryId) {
        this.categoryId = categoryId;
    }

    public String getCategoryName() {
        return categoryName;
    }

    public void setCategoryName(String categoryName) {
        this.categoryName = categoryName;
    }

    public int getViewerCount() {
        return viewerCount;
    }

    public void setViewerCount(int viewerCount) {
        this.viewerCount = viewerCount;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
    }
}
