package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.client.DiscordWebhookClient;
import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.dto.discord.DiscordEmbed;
import com.bbthechange.tvguide.dto.discord.DiscordMessageRequest;
import com.bbthechange.tvguide.dto.discord.DiscordMessageResponse;
import com.bbthechange.tvguide.exception.DiscordException;
import com.bbthechange.tvguide.model.ActiveBroadcastMessage;
import com.bbthechange.tvguide.model.ActiveBroadcasts;
import com.bbthechange.tvguide.model.BroadcastMetadata;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.repository.ActiveBroadcastRepository;
import com.bbthechange.tvguide.service.BroadcastMessageFactory;
import com.bbthechange.tvguide.util.CancellationSignal;
import com.bbthechange.tvguide.util.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ActiveBroadcastServiceImplTest {

    private static final Instant T0 = Instant.parse("2024-05-01T18:00:00Z");

    @Mock
    private DiscordWebhookClient discordClient;

    @Mock
    private ActiveBroadcastRepository repository;

    private MeterRegistry meterRegistry;
    private MutableClock clock;
    private ActiveBroadcastServiceImpl service;

    @BeforeEach
    void setUp() {
        TvGuideProperties properties = new TvGuideProperties();
        properties.getDiscord().setGuildId("10");
        properties.getDiscord().setChannelId("20");

        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(T0);
        service = new ActiveBroadcastServiceImpl(discordClient, repository,
                new BroadcastMessageFactory(properties), meterRegistry, clock);
    }

    @Nested
    @DisplayName("showLive")
    class ShowLiveTests {

        @Test
        @DisplayName("should post a message for a streamer without one")
        void showLive_UntrackedStreamer_CreatesMessage() {
            // Given
            givenState(new ActiveBroadcasts());
            when(discordClient.createMessage(any(DiscordMessageRequest.class), any()))
                    .thenReturn(new DiscordMessageResponse("900", "20"));

            // When
            service.showLive(List.of(live("1", "alpha")), false, CancellationSignal.NONE);

            // Then
            ArgumentCaptor<DiscordMessageRequest> requestCaptor = ArgumentCaptor.forClass(DiscordMessageRequest.class);
            verify(discordClient).createMessage(requestCaptor.capture(), eq(CancellationSignal.NONE));
            DiscordEmbed embed = requestCaptor.getValue().getEmbeds().get(0);
            assertThat(embed.getTitle()).isEqualTo("Alpha is now live!");
            assertThat(embed.getDescription()).isEqualTo("Playing things");

            assertThat(service.getActiveMessages()).singleElement().satisfies(message -> {
                assertThat(message.getStreamerId()).isEqualTo("1");
                assertThat(message.getMessageId()).isEqualTo("900");
                assertThat(message.getMediaRefreshedAt()).isEqualTo(T0);
            });
            verify(repository).save(any(ActiveBroadcasts.class), eq(CancellationSignal.NONE));
            assertThat(meterRegistry.counter("discord_message_total", "status", "created").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should edit instead of reposting when a message is already tracked")
        void showLive_TrackedStreamer_EditsMessage() {
            // Given
            givenState(stateWith(tracked("1", "900", T0.minusSeconds(120))));

            // When
            service.showLive(List.of(live("1", "alpha")), false, CancellationSignal.NONE);

            // Then
            verify(discordClient, never()).createMessage(any(), any());
            ArgumentCaptor<DiscordMessageRequest> requestCaptor = ArgumentCaptor.forClass(DiscordMessageRequest.class);
            verify(discordClient).editMessage(eq("900"), requestCaptor.capture(), any());
            String imageUrl = requestCaptor.getValue().getEmbeds().get(0).getImage().getUrl();
            assertThat(imageUrl).endsWith("?" + T0.minusSeconds(120).getEpochSecond());
            assertThat(service.getActiveMessages()).hasSize(1);
        }

        @Test
        @DisplayName("should bump the preview cache-buster when media refresh is requested")
        void showLive_RefreshMedia_UsesCurrentTimestamp() {
            // Given
            givenState(stateWith(tracked("1", "900", T0.minusSeconds(400))));

            // When
            service.showLive(List.of(live("1", "alpha")), true, CancellationSignal.NONE);

            // Then
            ArgumentCaptor<DiscordMessageRequest> requestCaptor = ArgumentCaptor.forClass(DiscordMessageRequest.class);
            verify(discordClient).editMessage(eq("900"), requestCaptor.capture(), any());
            assertThat(requestCaptor.getValue().getEmbeds().get(0).getImage().getUrl())
                    .endsWith("?" + T0.getEpochSecond());
            assertThat(service.getActiveMessages().get(0).getMediaRefreshedAt()).isEqualTo(T0);
        }

        @Test
        @DisplayName("should post a new message when the tracked one was deleted")
        void showLive_TrackedMessageDeleted_Recreates() {
            // Given
            givenState(stateWith(tracked("1", "900", T0)));
            when(discordClient.editMessage(eq("900"), any(), any()))
                    .thenThrow(new DiscordException(404, "Discord webhook returned status 404"));
            when(discordClient.createMessage(any(), any())).thenReturn(new DiscordMessageResponse("901", "20"));

            // When
            service.showLive(List.of(live("1", "alpha")), false, CancellationSignal.NONE);

            // Then
            assertThat(service.getActiveMessages()).extracting(ActiveBroadcastMessage::getMessageId)
                    .containsExactly("901");
        }

        @Test
        @DisplayName("should keep going when one streamer's message fails")
        void showLive_OneFails_OthersStillShown() {
            // Given
            givenState(new ActiveBroadcasts());
            when(discordClient.createMessage(any(), any()))
                    .thenThrow(new DiscordException(500, "Discord webhook returned status 500"))
                    .thenReturn(new DiscordMessageResponse("902", "20"));

            // When
            service.showLive(List.of(live("1", "alpha"), live("2", "bravo")), false, CancellationSignal.NONE);

            // Then
            assertThat(service.getActiveMessages()).extracting(ActiveBroadcastMessage::getStreamerId)
                    .containsExactly("2");
            assertThat(meterRegistry.counter("discord_message_total", "status", "error").count()).isEqualTo(1.0);
            verify(repository).save(any(ActiveBroadcasts.class), eq(CancellationSignal.NONE));
        }
    }

    @Nested
    @DisplayName("showEnded")
    class ShowEndedTests {

        @Test
        @DisplayName("should finish the message with the stream duration and stop tracking it")
        void showEnded_TrackedStreamer_EditsAndRemoves() {
            // Given
            givenState(stateWith(tracked("1", "900", T0)));
            clock.set(T0.plus(Duration.ofMinutes(90)));
            TrackedStreamer streamer = live("1", "alpha");
            streamer.getBroadcast().setStartedAt(T0);

            // When
            service.showEnded(List.of(streamer), CancellationSignal.NONE);

            // Then
            ArgumentCaptor<DiscordMessageRequest> requestCaptor = ArgumentCaptor.forClass(DiscordMessageRequest.class);
            verify(discordClient).editMessage(eq("900"), requestCaptor.capture(), any());
            DiscordEmbed embed = requestCaptor.getValue().getEmbeds().get(0);
            assertThat(embed.getTitle()).isEqualTo("Alpha finished streaming.");
            assertThat(embed.getFields()).singleElement().satisfies(field -> {
                assertThat(field.getName()).isEqualTo("Stream Duration");
                assertThat(field.getValue()).isEqualTo("1 hour and 30 minutes");
            });
            assertThat(service.getActiveMessages()).isEmpty();
            assertThat(meterRegistry.counter("discord_message_total", "status", "finished").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should stop tracking the message even when the edit fails")
        void showEnded_EditFails_StillRemoved() {
            // Given
            givenState(stateWith(tracked("1", "900", T0)));
            when(discordClient.editMessage(eq("900"), any(), any()))
                    .thenThrow(new DiscordException(500, "Discord webhook returned status 500"));

            // When
            service.showEnded(List.of(live("1", "alpha")), CancellationSignal.NONE);

            // Then
            assertThat(service.getActiveMessages()).isEmpty();
            assertThat(meterRegistry.counter("discord_message_total", "status", "error").count()).isEqualTo(1.0);
            verify(repository).save(any(ActiveBroadcasts.class), eq(CancellationSignal.NONE));
        }

        @Test
        @DisplayName("should do nothing for a streamer without message")
        void showEnded_Untracked_NoDiscordCall() {
            // Given
            givenState(new ActiveBroadcasts());

            // When
            service.showEnded(List.of(live("1", "alpha")), CancellationSignal.NONE);

            // Then
            verifyNoInteractions(discordClient);
        }
    }

    @Nested
    @DisplayName("updateSummary")
    class UpdateSummaryTests {

        @Test
        @DisplayName("should post the summary when none is tracked")
        void updateSummary_NoSummary_CreatesAndRemembersIt() {
            // Given
            givenState(stateWith(tracked("1", "900", T0)));
            when(discordClient.createMessage(any(), any())).thenReturn(new DiscordMessageResponse("100", "20"));

            // When
            service.updateSummary(CancellationSignal.NONE);

            // Then
            ArgumentCaptor<DiscordMessageRequest> requestCaptor = ArgumentCaptor.forClass(DiscordMessageRequest.class);
            verify(discordClient).createMessage(requestCaptor.capture(), any());
            assertThat(requestCaptor.getValue().getContent())
                    .isEqualTo("## Active Streams\n- [Alpha](https://discord.com/channels/10/20/900)");

            ArgumentCaptor<ActiveBroadcasts> stateCaptor = ArgumentCaptor.forClass(ActiveBroadcasts.class);
            verify(repository).save(stateCaptor.capture(), eq(CancellationSignal.NONE));
            assertThat(stateCaptor.getValue().getSummaryMessageId()).isEqualTo("100");
        }

        @Test
        @DisplayName("should edit the tracked summary")
        void updateSummary_Tracked_Edits() {
            // Given
            ActiveBroadcasts state = new ActiveBroadcasts();
            state.setSummaryMessageId("100");
            givenState(state);

            // When
            service.updateSummary(CancellationSignal.NONE);

            // Then
            ArgumentCaptor<DiscordMessageRequest> requestCaptor = ArgumentCaptor.forClass(DiscordMessageRequest.class);
            verify(discordClient).editMessage(eq("100"), requestCaptor.capture(), any());
            assertThat(requestCaptor.getValue().getContent())
                    .isEqualTo("## Active Streams\nNo streams are currently active");
            assertThat(requestCaptor.getValue().getEmbeds()).isEmpty();
            verify(discordClient, never()).createMessage(any(), any());
        }

        @Test
        @DisplayName("should repost the summary when it was deleted")
        void updateSummary_Deleted_Recreates() {
            // Given
            ActiveBroadcasts state = new ActiveBroadcasts();
            state.setSummaryMessageId("100");
            givenState(state);
            when(discordClient.editMessage(eq("100"), any(), any()))
                    .thenThrow(new DiscordException(404, "Discord webhook returned status 404"));
            when(discordClient.createMessage(any(), any())).thenReturn(new DiscordMessageResponse("101", "20"));

            // When
            service.updateSummary(CancellationSignal.NONE);

            // Then
            ArgumentCaptor<ActiveBroadcasts> stateCaptor = ArgumentCaptor.forClass(ActiveBroadcasts.class);
            verify(repository).save(stateCaptor.capture(), any());
            assertThat(stateCaptor.getValue().getSummaryMessageId()).isEqualTo("101");
        }
    }

    // Helpers

    private void givenState(ActiveBroadcasts state) {
        when(repository.load(any())).thenReturn(state);
        service.loadData(CancellationSignal.NONE);
    }

    private static ActiveBroadcasts stateWith(ActiveBroadcastMessage... messages) {
        ActiveBroadcasts state = new ActiveBroadcasts();
        state.getMessages().addAll(List.of(messages));
        return state;
    }

    private static ActiveBroadcastMessage tracked(String streamerId, String messageId, Instant mediaRefreshedAt) {
        ActiveBroadcastMessage message = new ActiveBroadcastMessage(
                streamerId, messageId, "alpha", "Alpha", T0.minus(Duration.ofMinutes(30)));
        message.setMediaRefreshedAt(mediaRefreshedAt);
        return message;
    }

    private static TrackedStreamer live(String id, String login) {
        TrackedStreamer streamer = new TrackedStreamer(id, login,
                Character.toUpperCase(login.charAt(0)) + login.substring(1), "https://img/" + login + ".png");
        streamer.setLive(true);
        streamer.setBroadcast(new BroadcastMetadata("s" + id, "Playing things", "509658", "Just Chatting", 12,
                T0.minus(Duration.ofMinutes(30))));
        return streamer;
    }
}
