package com.bbthechange.tvguide.dto.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for one user in the Helix response.
 * Maps an element of the {@code data} array from GET /users
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwitchUser {

    private String id;

    private String login;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("profile_image_url")
    private String profileImageUrl;
}
