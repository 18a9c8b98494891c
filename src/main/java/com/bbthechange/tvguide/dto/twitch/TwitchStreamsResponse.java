package com.bbthechange.tvguide.dto.twitch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for GET /streams.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwitchStreamsResponse {

    private List<TwitchStream> data = new ArrayList<>();

    private TwitchPagination pagination;

    /**
     * Cursor for the next page, or null when this is the last one.
     */
    public String nextCursor() {
        if (pagination == null || pagination.getCursor() == null || pagination.getCursor().isBlank()) {
            return null;
        }
        return pagination.getCursor();
    }
}
