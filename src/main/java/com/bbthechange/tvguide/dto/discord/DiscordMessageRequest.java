package com.bbthechange.tvguide.dto.discord;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body for executing a webhook or editing one of its messages.
 * An edit replaces both content and embeds, so an empty embed list clears them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiscordMessageRequest {

    private String content;

    private List<DiscordEmbed> embeds;

    public static DiscordMessageRequest ofContent(String content) {
        return DiscordMessageRequest.builder()
                .content(content)
                .embeds(List.of())
                .build();
    }

    public static DiscordMessageRequest ofEmbed(DiscordEmbed embed) {
        return DiscordMessageRequest.builder()
                .content("")
                .embeds(List.of(embed))
                .build();
    }
}
