package com.bbthechange.tvguide.dto;

import com.bbthechange.tvguide.model.BroadcastMetadata;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Operator view of a tracked streamer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrackedStreamerResponse {

    private String id;
    private String login;
    private String displayName;
    private boolean live;
    private Instant liveSince;
    private String title;
    private String category;
    private Integer viewerCount;

    public static TrackedStreamerResponse from(TrackedStreamer streamer) {
        TrackedStreamerResponseBuilder builder = TrackedStreamerResponse.builder()
                .id(streamer.getId())
                .login(streamer.getLogin())
                .displayName(streamer.getDisplayName())
                .live(streamer.isLive());

        BroadcastMetadata broadcast = streamer.getBroadcast();
        if (streamer.isLive() && broadcast != null) {
            builder.liveSince(broadcast.getStartedAt())
                    .title(broadcast.getTitle())
                    .category(broadcast.getCategoryName())
                    .viewerCount(broadcast.getViewerCount());
        }
        return builder.build();
    }
}
