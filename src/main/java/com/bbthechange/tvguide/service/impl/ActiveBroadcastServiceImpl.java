package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.client.DiscordWebhookClient;
import com.bbthechange.tvguide.dto.discord.DiscordMessageRequest;
import com.bbthechange.tvguide.dto.discord.DiscordMessageResponse;
import com.bbthechange.tvguide.exception.DiscordException;
import com.bbthechange.tvguide.model.ActiveBroadcastMessage;
import com.bbthechange.tvguide.model.ActiveBroadcasts;
import com.bbthechange.tvguide.model.BroadcastMetadata;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.repository.ActiveBroadcastRepository;
import com.bbthechange.tvguide.service.ActiveBroadcastService;
import com.bbthechange.tvguide.service.BroadcastMessageFactory;
import com.bbthechange.tvguide.util.CancellationSignal;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Keeps one Discord message per live streamer, keyed by streamer id, and a summary message linking to them.
 * Display state is saved after every change so a restart edits the existing messages instead of reposting.
 */
@Service
@ConditionalOnProperty(name = "tvguide.discord.enabled", havingValue = "true")
public class ActiveBroadcastServiceImpl implements ActiveBroadcastService {

    private static final Logger logger = LoggerFactory.getLogger(ActiveBroadcastServiceImpl.class);

    private final DiscordWebhookClient discordClient;
    private final ActiveBroadcastRepository repository;
    private final BroadcastMessageFactory messageFactory;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private ActiveBroadcasts state = new ActiveBroadcasts();

    @Autowired
    public ActiveBroadcastServiceImpl(
            DiscordWebhookClient discordClient,
            ActiveBroadcastRepository repository,
            BroadcastMessageFactory messageFactory,
            MeterRegistry meterRegistry) {
        this(discordClient, repository, messageFactory, meterRegistry, Clock.systemUTC());
    }

    ActiveBroadcastServiceImpl(
            DiscordWebhookClient discordClient,
            ActiveBroadcastRepository repository,
            BroadcastMessageFactory messageFactory,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.discordClient = discordClient;
        this.repository = repository;
        this.messageFactory = messageFactory;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public synchronized void loadData(CancellationSignal cancellation) {
        state = repository.load(cancellation);
        logger.info("Loaded {} active broadcast messages", state.getMessages().size());
    }

    @Override
    public synchronized void showLive(List<TrackedStreamer> streamers, boolean refreshMedia,
                                      CancellationSignal cancellation) {
        try {
            for (TrackedStreamer streamer : streamers) {
                cancellation.throwIfCancellationRequested();
                try {
                    showLive(streamer, refreshMedia, cancellation);
                } catch (CancellationException e) {
                    throw e;
                } catch (Exception e) {
                    logger.error("Failed to update live message for {}", streamer.getLogin(), e);
                    meterRegistry.counter("discord_message_total", "status", "error").increment();
                }
            }
        } finally {
            repository.save(state, CancellationSignal.NONE);
        }
    }

    private void showLive(TrackedStreamer streamer, boolean refreshMedia, CancellationSignal cancellation) {
        Instant now = clock.instant();
        Optional<ActiveBroadcastMessage> tracked = findMessage(streamer.getId());
        if (tracked.isEmpty()) {
            createLiveMessage(streamer, now, cancellation);
            return;
        }

        ActiveBroadcastMessage message = tracked.get();
        Instant previewTimestamp = refreshMedia || message.getMediaRefreshedAt() == null
                ? now
                : message.getMediaRefreshedAt();
        try {
            discordClient.editMessage(message.getMessageId(),
                    DiscordMessageRequest.ofEmbed(messageFactory.buildLiveEmbed(streamer, now, previewTimestamp)),
                    cancellation);
        } catch (DiscordException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            logger.warn("Live message {} for {} was deleted, posting a new one", message.getMessageId(), streamer.getLogin());
            state.getMessages().remove(message);
            createLiveMessage(streamer, now, cancellation);
            return;
        }

        message.setDisplayName(streamer.getDisplayName());
        message.setMediaRefreshedAt(previewTimestamp);
        meterRegistry.counter("discord_message_total", "status", "edited").increment();
    }

    private void createLiveMessage(TrackedStreamer streamer, Instant now, CancellationSignal cancellation) {
        DiscordMessageResponse response = discordClient.createMessage(
                DiscordMessageRequest.ofEmbed(messageFactory.buildLiveEmbed(streamer, now, now)), cancellation);

        BroadcastMetadata broadcast = streamer.getBroadcast();
        ActiveBroadcastMessage message = new ActiveBroadcastMessage(
                streamer.getId(), response.getId(), streamer.getLogin(), streamer.getDisplayName(),
                broadcast != null ? broadcast.getStartedAt() : null);
        message.setMediaRefreshedAt(now);
        state.getMessages().add(message);

        logger.info("Posted live message {} for {}", response.getId(), streamer.getLogin());
        meterRegistry.counter("discord_message_total", "status", "created").increment();
    }

    @Override
    public synchronized void showEnded(List<TrackedStreamer> streamers, CancellationSignal cancellation) {
        try {
            for (TrackedStreamer streamer : streamers) {
                cancellation.throwIfCancellationRequested();
                Optional<ActiveBroadcastMessage> tracked = findMessage(streamer.getId());
                if (tracked.isEmpty()) {
                    logger.debug("No live message tracked for {}, nothing to finish", streamer.getLogin());
                    continue;
                }
                finishMessage(streamer, tracked.get(), cancellation);
            }
        } finally {
            repository.save(state, CancellationSignal.NONE);
        }
    }

    private void finishMessage(TrackedStreamer streamer, ActiveBroadcastMessage message, CancellationSignal cancellation) {
        BroadcastMetadata broadcast = streamer.getBroadcast();
        Instant startedAt = broadcast != null && broadcast.getStartedAt() != null
                ? broadcast.getStartedAt()
                : message.getStartedAt();

        try {
            discordClient.editMessage(message.getMessageId(),
                    DiscordMessageRequest.ofEmbed(messageFactory.buildEndedEmbed(
                            streamer.getDisplayName(), streamer.getLogin(), streamer.getProfileImageUrl(),
                            startedAt, clock.instant())),
                    cancellation);
            logger.info("Marked message {} for {} as finished", message.getMessageId(), streamer.getLogin());
            meterRegistry.counter("discord_message_total", "status", "finished").increment();
        } catch (CancellationException e) {
            throw e;
        } catch (DiscordException e) {
            if (e.isNotFound()) {
                logger.warn("Live message {} for {} was deleted, dropping it", message.getMessageId(), streamer.getLogin());
            } else {
                logger.error("Failed to mark message {} for {} as finished", message.getMessageId(), streamer.getLogin(), e);
                meterRegistry.counter("discord_message_total", "status", "error").increment();
            }
        }
        // Ended broadcasts are never tracked, even when the edit failed
        state.getMessages().remove(message);
    }

    @Override
    public synchronized void updateSummary(CancellationSignal cancellation) {
        String content = messageFactory.buildSummary(state.getMessages());
        DiscordMessageRequest request = DiscordMessageRequest.ofContent(content);

        try {
            String summaryId = state.getSummaryMessageId();
            if (summaryId != null) {
                try {
                    discordClient.editMessage(summaryId, request, cancellation);
                    logger.debug("Summary message updated");
                    return;
                } catch (DiscordException e) {
                    if (!e.isNotFound()) {
                        throw e;
                    }
                    logger.warn("Summary message {} was deleted, posting a new one", summaryId);
                }
            }

            DiscordMessageResponse response = discordClient.createMessage(request, cancellation);
            state.setSummaryMessageId(response.getId());
            logger.info("Posted summary message {}", response.getId());
        } finally {
            repository.save(state, CancellationSignal.NONE);
        }
    }

    @Override
    public synchronized List<ActiveBroadcastMessage> getActiveMessages() {
        return new ArrayList<>(state.getMessages());
    }

    private Optional<ActiveBroadcastMessage> findMessage(String streamerId) {
        return state.getMessages().stream()
                .filter(message -> streamerId.equals(message.getStreamerId()))
                .findFirst();
    }
}
