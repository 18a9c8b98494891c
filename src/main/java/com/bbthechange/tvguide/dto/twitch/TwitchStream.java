package com.bbthechange.tvguide.dto.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for one live stream in the Helix response.
 * Maps an element of the {@code data} array from GET /streams
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwitchStream {

    /**
     * Stream ID. Changes with every new broadcast.
     */
    private String id;

    /**
     * Twitch user ID of the broadcaster.
     */
    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("user_login")
    private String userLogin;

    @JsonProperty("user_name")
    private String userName;

    @JsonProperty("game_id")
    private String gameId;

    @JsonProperty("game_name")
    private String gameName;

    /**
     * "live" for live streams, empty string on error.
     */
    private String type;

    private String title;

    @JsonProperty("viewer_count")
    private Integer viewerCount;

    /**
     * UTC timestamp when the broadcast began.
     */
    @JsonProperty("started_at")
    private Instant startedAt;

    /**
     * Thumbnail template with {width} and {height} placeholders.
     */
    @JsonProperty("thumbnail_url")
    private String thumbnailUrl;
}
