package com.bbthechange.tvguide.repository.impl;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.model.ActiveBroadcasts;
import com.bbthechange.tvguide.repository.ActiveBroadcastRepository;
import com.bbthechange.tvguide.util.CancellationSignal;
import com.bbthechange.tvguide.util.JsonFileStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;

/**
 * Stores the Discord display state in {@code tvguide.now-live.active-broadcasts-file}.
 */
@Repository
public class JsonFileActiveBroadcastRepository implements ActiveBroadcastRepository {

    private final JsonFileStore<ActiveBroadcasts> store;

    @Autowired
    public JsonFileActiveBroadcastRepository(TvGuideProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getNowLive().getActiveBroadcastsFile()), objectMapper);
    }

    JsonFileActiveBroadcastRepository(Path path, ObjectMapper objectMapper) {
        this.store = new JsonFileStore<>(path, objectMapper, new TypeReference<ActiveBroadcasts>() {});
    }

    @Override
    public ActiveBroadcasts load(CancellationSignal cancellation) {
        return store.read(cancellation).orElseGet(ActiveBroadcasts::new);
    }

    @Override
    public void save(ActiveBroadcasts activeBroadcasts, CancellationSignal cancellation) {
        store.write(activeBroadcasts, cancellation);
    }
}
