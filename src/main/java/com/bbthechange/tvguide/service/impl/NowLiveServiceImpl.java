package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.dto.event.ServiceLifecycleEvent;
import com.bbthechange.tvguide.dto.event.StreamerBatchEvent;
import com.bbthechange.tvguide.dto.event.StreamerErrorEvent;
import com.bbthechange.tvguide.dto.twitch.TwitchStream;
import com.bbthechange.tvguide.dto.twitch.TwitchUser;
import com.bbthechange.tvguide.listener.BroadcastStateListener;
import com.bbthechange.tvguide.model.BroadcastMetadata;
import com.bbthechange.tvguide.model.BroadcastTransition;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.repository.RosterRepository;
import com.bbthechange.tvguide.service.NowLiveService;
import com.bbthechange.tvguide.service.StreamStatusSource;
import com.bbthechange.tvguide.service.StreamerLookup;
import com.bbthechange.tvguide.service.StreamerManagementResult;
import com.bbthechange.tvguide.util.CancellationSignal;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Broadcast-state reconciliation engine.
 *
 * Each tick splits the roster into batches no larger than the Helix per-request cap. A batch is queried once,
 * every streamer in it is classified into a {@link BroadcastTransition}, and then each non-empty bucket is
 * delivered to the listeners in a single callback. A batch that fails is reported streamer by streamer and
 * does not stop the remaining batches. The roster is saved at the end of every tick.
 */
@Service
public class NowLiveServiceImpl implements NowLiveService {

    private static final Logger logger = LoggerFactory.getLogger(NowLiveServiceImpl.class);

    static final int HELIX_MAX_USERS_PER_REQUEST = 100;
    static final String BATCH_ERROR_MESSAGE = "Was not updated";

    private final StreamStatusSource statusSource;
    private final StreamerLookup streamerLookup;
    private final RosterRepository rosterRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int maxUsersPerRequest;
    private final Duration mediaRefreshInterval;

    private final Map<String, TrackedStreamer> roster = new ConcurrentHashMap<>();
    private final List<BroadcastStateListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock tickLock = new ReentrantLock();

    @Autowired
    public NowLiveServiceImpl(
            StreamStatusSource statusSource,
            StreamerLookup streamerLookup,
            RosterRepository rosterRepository,
            MeterRegistry meterRegistry,
            TvGuideProperties properties) {
        this(statusSource, streamerLookup, rosterRepository, meterRegistry, Clock.systemUTC(),
                properties.getNowLive().getMaxUsersPerRequest(),
                properties.getNowLive().getMediaRefreshInterval());
    }

    /**
     * Constructor for testing with a controllable clock.
     */
    NowLiveServiceImpl(
            StreamStatusSource statusSource,
            StreamerLookup streamerLookup,
            RosterRepository rosterRepository,
            MeterRegistry meterRegistry,
            Clock clock,
            int maxUsersPerRequest,
            Duration mediaRefreshInterval) {
        if (maxUsersPerRequest < 1 || maxUsersPerRequest > HELIX_MAX_USERS_PER_REQUEST) {
            throw new IllegalArgumentException("maxUsersPerRequest must be between 1 and "
                    + HELIX_MAX_USERS_PER_REQUEST + ", got " + maxUsersPerRequest);
        }
        this.statusSource = statusSource;
        this.streamerLookup = streamerLookup;
        this.rosterRepository = rosterRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.maxUsersPerRequest = maxUsersPerRequest;
        this.mediaRefreshInterval = mediaRefreshInterval;

        meterRegistry.gaugeMapSize("nowlive_tracked_streamers", Tags.empty(), roster);
    }

    @Override
    public StreamerManagementResult addStreamer(String login, CancellationSignal cancellation) {
        Optional<TwitchUser> lookup = streamerLookup.findByLogin(login, cancellation);
        if (lookup.isEmpty()) {
            logger.warn("Cannot track {}: no such Twitch user", login);
            return StreamerManagementResult.NOT_FOUND;
        }

        TwitchUser user = lookup.get();
        TrackedStreamer streamer = new TrackedStreamer(
                user.getId(), user.getLogin(), user.getDisplayName(), user.getProfileImageUrl());

        if (roster.putIfAbsent(streamer.getId(), streamer) != null) {
            logger.warn("Streamer {} ({}) is already tracked", streamer.getLogin(), streamer.getId());
            return StreamerManagementResult.ALREADY_EXISTS;
        }

        logger.info("Now tracking streamer {} ({})", streamer.getLogin(), streamer.getId());
        StreamerBatchEvent event = StreamerBatchEvent.of(streamer, cancellation);
        notifyListeners("onStreamerAdded", listener -> listener.onStreamerAdded(event));
        saveRoster(cancellation);
        return StreamerManagementResult.SUCCESS;
    }

    @Override
    public StreamerManagementResult removeStreamer(String login, CancellationSignal cancellation) {
        Optional<TrackedStreamer> match = roster.values().stream()
                .filter(streamer -> streamer.hasLogin(login))
                .findFirst();
        if (match.isEmpty()) {
            logger.warn("Cannot remove {}: not tracked", login);
            return StreamerManagementResult.NOT_FOUND;
        }

        TrackedStreamer removed = roster.remove(match.get().getId());
        if (removed == null) {
            logger.error("Streamer {} disappeared from the roster before it could be removed", login);
            return StreamerManagementResult.ERROR;
        }

        logger.info("Stopped tracking streamer {} ({})", removed.getLogin(), removed.getId());
        StreamerBatchEvent event = StreamerBatchEvent.of(removed, cancellation);
        notifyListeners("onStreamerRemoved", listener -> listener.onStreamerRemoved(event));
        saveRoster(cancellation);
        return StreamerManagementResult.SUCCESS;
    }

    @Override
    public void tick(CancellationSignal cancellation) {
        lockTick();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            List<List<String>> batches = partition(new ArrayList<>(roster.keySet()));
            logger.debug("Polling {} tracked streamers in {} batches", roster.size(), batches.size());

            for (List<String> batch : batches) {
                cancellation.throwIfCancellationRequested();
                processBatch(batch, cancellation);
            }

            rosterRepository.saveRoster(getTrackedStreamers(), cancellation);
        } catch (CancellationException e) {
            status = "cancelled";
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("nowlive_tick_duration", "status", status));
            meterRegistry.counter("nowlive_tick_total", "status", status).increment();
            tickLock.unlock();
        }
    }

    private void processBatch(List<String> batch, CancellationSignal cancellation) {
        Map<BroadcastTransition, List<TrackedStreamer>> buckets;
        try {
            Map<String, TwitchStream> streamsByUser = statusSource.getLiveStreams(batch, cancellation).stream()
                    .filter(stream -> stream.getUserId() != null)
                    .collect(Collectors.toMap(TwitchStream::getUserId, Function.identity(), (first, second) -> first));

            Instant now = clock.instant();
            buckets = batch.parallelStream()
                    .map(id -> classify(id, streamsByUser.get(id), now))
                    .filter(Objects::nonNull)
                    .collect(Collectors.groupingBy(
                            Classification::transition,
                            () -> new EnumMap<>(BroadcastTransition.class),
                            Collectors.mapping(Classification::streamer, Collectors.toList())));
        } catch (CancellationException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to update batch of {} streamers", batch.size(), e);
            meterRegistry.counter("nowlive_batch_errors_total").increment();
            for (String id : batch) {
                StreamerErrorEvent event = new StreamerErrorEvent(id, BATCH_ERROR_MESSAGE, e, cancellation);
                notifyListeners("onStreamerError", listener -> listener.onStreamerError(event));
            }
            return;
        }

        logger.debug("Batch of {}: {}", batch.size(), summarize(buckets));
        dispatch(buckets, cancellation);
    }

    /**
     * Apply the observation to the streamer under the map's per-key lock.
     *
     * @return the transition, or null when the streamer was removed or stayed offline
     */
    private Classification classify(String id, TwitchStream stream, Instant now) {
        AtomicReference<BroadcastTransition> transition = new AtomicReference<>();
        TrackedStreamer updated = roster.computeIfPresent(id, (key, streamer) -> {
            transition.set(applyObservation(streamer, stream, now));
            return streamer;
        });
        if (updated == null || transition.get() == null) {
            return null;
        }
        return new Classification(transition.get(), updated);
    }

    private BroadcastTransition applyObservation(TrackedStreamer streamer, TwitchStream stream, Instant now) {
        boolean liveNow = stream != null;

        if (liveNow && !streamer.isLive()) {
            streamer.setLive(true);
            streamer.setLastOnline(now);
            streamer.setNextMediaRefreshAt(now.plus(mediaRefreshInterval));
            streamer.setBroadcast(toMetadata(stream));
            return BroadcastTransition.DETECTED_LIVE;
        }

        if (liveNow) {
            streamer.setBroadcast(toMetadata(stream));
            Instant refreshAt = streamer.getNextMediaRefreshAt();
            // Unknown deadline counts as due
            if (refreshAt == null || !now.isBefore(refreshAt)) {
                streamer.setNextMediaRefreshAt(now.plus(mediaRefreshInterval));
                return BroadcastTransition.MEDIA_REFRESH_DUE;
            }
            return BroadcastTransition.CONTINUING;
        }

        if (streamer.isLive()) {
            streamer.setLive(false);
            streamer.setLastOnline(null);
            streamer.setNextMediaRefreshAt(null);
            return BroadcastTransition.ENDED;
        }

        return null;
    }

    private void dispatch(Map<BroadcastTransition, List<TrackedStreamer>> buckets, CancellationSignal cancellation) {
        try {
            for (BroadcastTransition transition : BroadcastTransition.values()) {
                List<TrackedStreamer> streamers = buckets.get(transition);
                if (streamers == null || streamers.isEmpty()) {
                    continue;
                }

                meterRegistry.counter("nowlive_transitions_total", "bucket", transition.getMetricTag())
                        .increment(streamers.size());

                StreamerBatchEvent event = new StreamerBatchEvent(streamers, cancellation);
                switch (transition) {
                    case DETECTED_LIVE -> notifyListeners("onStreamersDetectedLive",
                            listener -> listener.onStreamersDetectedLive(event));
                    case ENDED -> notifyListeners("onStreamersEnded",
                            listener -> listener.onStreamersEnded(event));
                    case CONTINUING -> notifyListeners("onStreamersContinuing",
                            listener -> listener.onStreamersContinuing(event));
                    case MEDIA_REFRESH_DUE -> notifyListeners("onStreamersMediaRefreshDue",
                            listener -> listener.onStreamersMediaRefreshDue(event));
                }
            }
        } finally {
            // Ended listeners have seen the broadcast, now drop it
            for (TrackedStreamer ended : buckets.getOrDefault(BroadcastTransition.ENDED, List.of())) {
                roster.computeIfPresent(ended.getId(), (id, streamer) -> {
                    if (!streamer.isLive()) {
                        streamer.setBroadcast(null);
                    }
                    return streamer;
                });
            }
        }
    }

    private void notifyListeners(String callback, Consumer<BroadcastStateListener> action) {
        for (BroadcastStateListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                logger.error("Listener {} failed in {}", listener.getClass().getSimpleName(), callback, e);
            }
        }
    }

    @Override
    public void loadRoster(CancellationSignal cancellation) {
        List<TrackedStreamer> loaded = rosterRepository.loadRoster(cancellation);

        roster.clear();
        for (TrackedStreamer streamer : loaded) {
            if (!streamer.isLive()) {
                streamer.setBroadcast(null);
                streamer.setNextMediaRefreshAt(null);
            }
            if (roster.putIfAbsent(streamer.getId(), streamer) != null) {
                logger.warn("Ignoring duplicate roster entry for streamer {}", streamer.getId());
            }
        }

        long live = roster.values().stream().filter(TrackedStreamer::isLive).count();
        logger.info("Roster loaded: {} tracked streamers, {} believed live", roster.size(), live);
    }

    @Override
    public void saveRoster(CancellationSignal cancellation) {
        rosterRepository.saveRoster(getTrackedStreamers(), cancellation);
    }

    @Override
    public List<TrackedStreamer> getTrackedStreamers() {
        return new ArrayList<>(roster.values());
    }

    @Override
    public void registerListener(BroadcastStateListener listener) {
        listeners.add(listener);
        logger.debug("Registered listener {}", listener.getClass().getSimpleName());
    }

    @Override
    public void unregisterListener(BroadcastStateListener listener) {
        listeners.remove(listener);
        logger.debug("Unregistered listener {}", listener.getClass().getSimpleName());
    }

    @Override
    public void notifyServiceStarted() {
        ServiceLifecycleEvent event = lifecycleEvent(ServiceLifecycleEvent.Phase.STARTED, CancellationSignal.NONE);
        notifyListeners("onServiceStarted", listener -> listener.onServiceStarted(event));
    }

    @Override
    public void notifyServiceStarting(CancellationSignal cancellation) {
        ServiceLifecycleEvent event = lifecycleEvent(ServiceLifecycleEvent.Phase.STARTING, cancellation);
        notifyListeners("onServiceStarting", listener -> listener.onServiceStarting(event));
    }

    @Override
    public void notifyServiceExiting(CancellationSignal cancellation) {
        ServiceLifecycleEvent event = lifecycleEvent(ServiceLifecycleEvent.Phase.EXITING, cancellation);
        notifyListeners("onServiceExiting", listener -> listener.onServiceExiting(event));
    }

    @Override
    public void notifyServiceExited() {
        ServiceLifecycleEvent event = lifecycleEvent(ServiceLifecycleEvent.Phase.EXITED, CancellationSignal.NONE);
        notifyListeners("onServiceExited", listener -> listener.onServiceExited(event));
    }

    private ServiceLifecycleEvent lifecycleEvent(ServiceLifecycleEvent.Phase phase, CancellationSignal cancellation) {
        return new ServiceLifecycleEvent(phase, clock.instant(), cancellation);
    }

    private List<List<String>> partition(List<String> ids) {
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < ids.size(); start += maxUsersPerRequest) {
            batches.add(ids.subList(start, Math.min(start + maxUsersPerRequest, ids.size())));
        }
        return batches;
    }

    private void lockTick() {
        try {
            tickLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for the running tick");
        }
    }

    private static BroadcastMetadata toMetadata(TwitchStream stream) {
        BroadcastMetadata metadata = new BroadcastMetadata(
                stream.getId(),
                stream.getTitle(),
                stream.getGameId(),
                stream.getGameName(),
                stream.getViewerCount() != null ? stream.getViewerCount() : 0,
                stream.getStartedAt());
        metadata.setThumbnailUrl(stream.getThumbnailUrl());
        return metadata;
    }

    private static String summarize(Map<BroadcastTransition, List<TrackedStreamer>> buckets) {
        if (buckets.isEmpty()) {
            return "no transitions";
        }
        return buckets.entrySet().stream()
                .map(entry -> entry.getKey().getMetricTag() + "=" + entry.getValue().size())
                .collect(Collectors.joining(", "));
    }

    private record Classification(BroadcastTransition transition, TrackedStreamer streamer) {
    }
}
