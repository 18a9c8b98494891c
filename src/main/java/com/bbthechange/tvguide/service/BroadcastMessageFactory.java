package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.dto.discord.DiscordEmbed;
import com.bbthechange.tvguide.model.ActiveBroadcastMessage;
import com.bbthechange.tvguide.model.BroadcastMetadata;
import com.bbthechange.tvguide.model.TrackedStreamer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the Discord embeds for a streamer's broadcast and the summary of active broadcasts.
 */
@Component
public class BroadcastMessageFactory {

    static final String SUMMARY_HEADER = "## Active Streams";
    static final String NO_ACTIVE_STREAMS = SUMMARY_HEADER + "\nNo streams are currently active";

    private final TvGuideProperties properties;

    public BroadcastMessageFactory(TvGuideProperties properties) {
        this.properties = properties;
    }

    /**
     * Embed announcing a running broadcast.
     *
     * @param previewTimestamp appended to the preview image URL; a new value makes Discord refetch the image
     */
    public DiscordEmbed buildLiveEmbed(TrackedStreamer streamer, Instant now, Instant previewTimestamp) {
        BroadcastMetadata broadcast = streamer.getBroadcast();
        if (broadcast == null) {
            throw new IllegalArgumentException("Streamer " + streamer.getId() + " has no broadcast");
        }

        List<DiscordEmbed.Field> fields = new ArrayList<>();
        if (broadcast.getStartedAt() != null) {
            fields.add(new DiscordEmbed.Field("Started", "<t:" + broadcast.getStartedAt().getEpochSecond() + ":R>", true));
        }
        fields.add(new DiscordEmbed.Field("Viewers", String.valueOf(broadcast.getViewerCount()), true));
        if (broadcast.getCategoryName() != null && !broadcast.getCategoryName().isBlank()) {
            fields.add(new DiscordEmbed.Field("Category", broadcast.getCategoryName(), true));
        }

        return baseEmbed(now)
                .title(streamer.getDisplayName() + " is now live!")
                .description(broadcast.getTitle())
                .url(channelUrl(streamer.getLogin()))
                .color(properties.getDiscord().getOnlineColor())
                .thumbnail(imageOrNull(streamer.getProfileImageUrl()))
                .image(new DiscordEmbed.Image(previewUrl(streamer.getLogin(), previewTimestamp)))
                .fields(fields)
                .build();
    }

    /**
     * Embed replacing a live announcement once the broadcast is over.
     *
     * @param startedAt when the broadcast began, or null if unknown
     */
    public DiscordEmbed buildEndedEmbed(String displayName, String login, String profileImageUrl,
                                        Instant startedAt, Instant now) {
        List<DiscordEmbed.Field> fields = new ArrayList<>();
        if (startedAt != null) {
            fields.add(new DiscordEmbed.Field("Stream Duration", formatDuration(Duration.between(startedAt, now)), true));
        }

        return baseEmbed(now)
                .title(displayName + " finished streaming.")
                .url(channelUrl(login))
                .color(properties.getDiscord().getOfflineColor())
                .thumbnail(imageOrNull(profileImageUrl))
                .fields(fields)
                .build();
    }

    /**
     * Summary listing one link per live broadcast message, in the given order.
     */
    public String buildSummary(List<ActiveBroadcastMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return NO_ACTIVE_STREAMS;
        }
        return SUMMARY_HEADER + "\n" + messages.stream()
                .map(message -> "- [" + message.getDisplayName() + "](" + messageLink(message.getMessageId()) + ")")
                .collect(Collectors.joining("\n"));
    }

    public String messageLink(String messageId) {
        TvGuideProperties.Discord discord = properties.getDiscord();
        return "https://discord.com/channels/" + discord.getGuildId() + "/" + discord.getChannelId() + "/" + messageId;
    }

    public static String channelUrl(String login) {
        return "https://www.twitch.tv/" + login;
    }

    public static String previewUrl(String login, Instant timestamp) {
        return "https://static-cdn.jtvnw.net/previews-ttv/live_user_" + login + "-1280x720.jpg?" + timestamp.getEpochSecond();
    }

    /**
     * Human-readable duration: "45 minutes", "1 hour", "2 hours and 1 minute".
     */
    public static String formatDuration(Duration duration) {
        if (duration.isNegative()) {
            duration = Duration.ZERO;
        }
        if (duration.toMinutes() < 60) {
            return label(duration.toMinutes(), "minute");
        }

        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        String hoursText = label(hours, "hour");
        return minutes > 0 ? hoursText + " and " + label(minutes, "minute") : hoursText;
    }

    private static String label(long value, String singular) {
        return value + " " + singular + (value == 1 ? "" : "s");
    }

    private DiscordEmbed.DiscordEmbedBuilder baseEmbed(Instant now) {
        String footerIcon = properties.getDiscord().getFooterIcon();
        return DiscordEmbed.builder()
                .timestamp(now.toString())
                .footer(new DiscordEmbed.Footer(
                        properties.getApplicationName() + " v" + properties.getApplicationVersion(),
                        footerIcon == null || footerIcon.isBlank() ? null : footerIcon));
    }

    private static DiscordEmbed.Image imageOrNull(String url) {
        return url == null || url.isBlank() ? null : new DiscordEmbed.Image(url);
    }
}
