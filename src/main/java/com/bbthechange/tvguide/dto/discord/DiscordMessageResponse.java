package com.bbthechange.tvguide.dto.discord;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The message object Discord returns for {@code ?wait=true} executions and edits.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscordMessageResponse {

    private String id;

    @JsonProperty("channel_id")
    private String channelId;
}
