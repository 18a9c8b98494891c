package com.bbthechange.tvguide.repository.impl;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.repository.RosterRepository;
import com.bbthechange.tvguide.util.CancellationSignal;
import com.bbthechange.tvguide.util.JsonFileStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores the roster as a JSON array in {@code tvguide.now-live.user-data-file}.
 */
@Repository
public class JsonFileRosterRepository implements RosterRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileRosterRepository.class);

    private final JsonFileStore<List<TrackedStreamer>> store;

    @Autowired
    public JsonFileRosterRepository(TvGuideProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getNowLive().getUserDataFile()), objectMapper);
    }

    JsonFileRosterRepository(Path path, ObjectMapper objectMapper) {
        this.store = new JsonFileStore<>(path, objectMapper, new TypeReference<List<TrackedStreamer>>() {});
    }

    @Override
    public List<TrackedStreamer> loadRoster(CancellationSignal cancellation) {
        List<TrackedStreamer> streamers = store.read(cancellation).orElseGet(ArrayList::new);
        streamers.removeIf(streamer -> streamer == null || streamer.getId() == null);
        logger.info("Loaded {} tracked streamers from {}", streamers.size(), store.getPath());
        return streamers;
    }

    @Override
    public void saveRoster(List<TrackedStreamer> streamers, CancellationSignal cancellation) {
        store.write(streamers, cancellation);
        logger.debug("Saved {} tracked streamers to {}", streamers.size(), store.getPath());
    }
}
