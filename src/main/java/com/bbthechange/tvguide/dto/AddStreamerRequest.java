package com.bbthechange.tvguide.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Request DTO for tracking a Twitch streamer.
 */
@Data
public class AddStreamerRequest {

    @NotBlank(message = "Login is required")
    @Pattern(regexp = "[A-Za-z0-9_]{1,25}", message = "Invalid Twitch login")
    private String login;

    public AddStreamerRequest() {}

    public AddStreamerRequest(String login) {
        this.login = login;
    }
}
