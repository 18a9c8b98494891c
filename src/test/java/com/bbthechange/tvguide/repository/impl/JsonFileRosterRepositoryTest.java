package com.bbthechange.tvguide.repository.impl;

import com.bbthechange.tvguide.exception.RepositoryException;
import com.bbthechange.tvguide.model.BroadcastMetadata;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.util.CancellationSignal;
import com.bbthechange.tvguide.util.CancellationSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileRosterRepositoryTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Path dataFile;
    private JsonFileRosterRepository repository;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        dataFile = tempDir.resolve("NowLiveUserData.json");
        repository = new JsonFileRosterRepository(dataFile, objectMapper);
    }

    @Test
    @DisplayName("should start empty when the file does not exist")
    void loadRoster_MissingFile_ReturnsEmpty() {
        assertThat(repository.loadRoster(CancellationSignal.NONE)).isEmpty();
    }

    @Test
    @DisplayName("should start empty when the file is zero-length")
    void loadRoster_EmptyFile_ReturnsEmpty() throws Exception {
        // Given
        Files.createFile(dataFile);

        // When/Then
        assertThat(repository.loadRoster(CancellationSignal.NONE)).isEmpty();
    }

    @Test
    @DisplayName("should start empty when the file is not valid JSON")
    void loadRoster_MalformedFile_ReturnsEmpty() throws Exception {
        // Given
        Files.writeString(dataFile, "[{\"id\": \"1\", ");

        // When/Then
        assertThat(repository.loadRoster(CancellationSignal.NONE)).isEmpty();
    }

    @Test
    @DisplayName("should read back what was saved, including broadcast state")
    void saveRoster_ThenLoad_PreservesStreamers() {
        // Given
        TrackedStreamer live = new TrackedStreamer("1", "alpha", "Alpha", "https://img/alpha.png");
        live.setLive(true);
        live.setLastOnline(Instant.parse("2024-05-01T18:00:00Z"));
        live.setNextMediaRefreshAt(Instant.parse("2024-05-01T18:06:00Z"));
        live.setBroadcast(new BroadcastMetadata("s1", "Hello", "509658", "Just Chatting", 42,
                Instant.parse("2024-05-01T17:55:00Z")));
        TrackedStreamer offline = new TrackedStreamer("2", "bravo", "Bravo", null);

        // When
        repository.saveRoster(List.of(live, offline), CancellationSignal.NONE);
        List<TrackedStreamer> loaded = repository.loadRoster(CancellationSignal.NONE);

        // Then
        assertThat(loaded).hasSize(2);
        TrackedStreamer reloaded = loaded.get(0);
        assertThat(reloaded.getId()).isEqualTo("1");
        assertThat(reloaded.isLive()).isTrue();
        assertThat(reloaded.getNextMediaRefreshAt()).isEqualTo(Instant.parse("2024-05-01T18:06:00Z"));
        assertThat(reloaded.getBroadcast().getCategoryName()).isEqualTo("Just Chatting");
        assertThat(reloaded.getBroadcast().getStartedAt()).isEqualTo(Instant.parse("2024-05-01T17:55:00Z"));
        assertThat(loaded.get(1).isLive()).isFalse();
        assertThat(loaded.get(1).getBroadcast()).isNull();
    }

    @Test
    @DisplayName("should ignore unknown fields and entries without id")
    void loadRoster_UnknownFieldsAndMissingIds_Tolerated() throws Exception {
        // Given
        Files.writeString(dataFile, """
            [
                {"id": "1", "login": "alpha", "displayName": "Alpha", "live": false, "legacyFlag": true},
                {"login": "ghost"},
                null
            ]
            """);

        // When
        List<TrackedStreamer> loaded = repository.loadRoster(CancellationSignal.NONE);

        // Then
        assertThat(loaded).extracting(TrackedStreamer::getId).containsExactly("1");
    }

    @Test
    @DisplayName("should replace the previous content on save")
    void saveRoster_Twice_LastWriteWins() {
        // Given
        repository.saveRoster(List.of(new TrackedStreamer("1", "alpha", "Alpha", null)), CancellationSignal.NONE);

        // When
        repository.saveRoster(List.of(new TrackedStreamer("2", "bravo", "Bravo", null)), CancellationSignal.NONE);

        // Then
        assertThat(repository.loadRoster(CancellationSignal.NONE))
                .extracting(TrackedStreamer::getLogin)
                .containsExactly("bravo");
        assertThat(tempDir.resolve("NowLiveUserData.json.tmp")).doesNotExist();
    }

    @Test
    @DisplayName("should not write when cancelled")
    void saveRoster_Cancelled_Throws() {
        // Given
        CancellationSource source = new CancellationSource();
        source.cancel();

        // When/Then
        assertThatThrownBy(() -> repository.saveRoster(List.of(), source))
                .isInstanceOf(CancellationException.class);
        assertThat(dataFile).doesNotExist();
    }

    @Test
    @DisplayName("should throw RepositoryException when the file cannot be written")
    void saveRoster_UnwritableLocation_Throws() throws Exception {
        // Given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        JsonFileRosterRepository broken = new JsonFileRosterRepository(blocker.resolve("roster.json"), objectMapper);

        // When/Then
        assertThatThrownBy(() -> broken.saveRoster(List.of(), CancellationSignal.NONE))
                .isInstanceOf(RepositoryException.class);
    }
}
