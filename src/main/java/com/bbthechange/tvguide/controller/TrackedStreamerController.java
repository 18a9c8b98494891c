package com.bbthechange.tvguide.controller;

import com.bbthechange.tvguide.dto.AddStreamerRequest;
import com.bbthechange.tvguide.dto.TrackedStreamerResponse;
import com.bbthechange.tvguide.service.NowLiveService;
import com.bbthechange.tvguide.service.StreamerManagementResult;
import com.bbthechange.tvguide.service.impl.NowLiveBackgroundService;
import com.bbthechange.tvguide.util.CancellationSignal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Internal controller for managing the tracked-streamer roster.
 * Protected by InternalApiKeyFilter (X-Api-Key header).
 */
@RestController
@RequestMapping("/internal/streamers")
@Tag(name = "Tracked Streamers", description = "Operator commands for the now-live roster")
public class TrackedStreamerController {

    private static final Logger logger = LoggerFactory.getLogger(TrackedStreamerController.class);

    private final NowLiveService nowLiveService;
    private final ObjectProvider<NowLiveBackgroundService> backgroundService;

    public TrackedStreamerController(NowLiveService nowLiveService,
                                     ObjectProvider<NowLiveBackgroundService> backgroundService) {
        this.nowLiveService = nowLiveService;
        this.backgroundService = backgroundService;
    }

    @GetMapping
    @Operation(summary = "List tracked streamers", description = "Returns every tracked streamer with its live state")
    public ResponseEntity<List<TrackedStreamerResponse>> getTrackedStreamers() {
        List<TrackedStreamerResponse> streamers = nowLiveService.getTrackedStreamers().stream()
                .map(TrackedStreamerResponse::from)
                .sorted(Comparator.comparing(TrackedStreamerResponse::getLogin, String.CASE_INSENSITIVE_ORDER))
                .toList();
        return ResponseEntity.ok(streamers);
    }

    @PostMapping
    @Operation(summary = "Track a streamer", description = "Resolves the Twitch login and adds it to the roster")
    public ResponseEntity<Map<String, String>> addStreamer(@Valid @RequestBody AddStreamerRequest request) {
        logger.info("Operator requested tracking of {}", request.getLogin());

        StreamerManagementResult result = nowLiveService.addStreamer(request.getLogin(), CancellationSignal.NONE);
        return switch (result) {
            case SUCCESS -> respond(HttpStatus.CREATED, result, "Successfully added " + request.getLogin());
            case NOT_FOUND -> respond(HttpStatus.NOT_FOUND, result, "Twitch user " + request.getLogin() + " not found");
            case ALREADY_EXISTS -> respond(HttpStatus.CONFLICT, result, request.getLogin() + " is already tracked");
            case ERROR -> respond(HttpStatus.INTERNAL_SERVER_ERROR, result, "Failed to add " + request.getLogin());
        };
    }

    @DeleteMapping("/{login}")
    @Operation(summary = "Stop tracking a streamer", description = "Removes the streamer with the given login, ignoring case")
    public ResponseEntity<Map<String, String>> removeStreamer(@PathVariable String login) {
        logger.info("Operator requested removal of {}", login);

        StreamerManagementResult result = nowLiveService.removeStreamer(login, CancellationSignal.NONE);
        return switch (result) {
            case SUCCESS -> ResponseEntity.noContent().build();
            case NOT_FOUND -> respond(HttpStatus.NOT_FOUND, result, login + " is not tracked");
            case ALREADY_EXISTS, ERROR -> respond(HttpStatus.INTERNAL_SERVER_ERROR, result, "Failed to remove " + login);
        };
    }

    @PostMapping("/tick")
    @Operation(summary = "Run a poll tick now", description = "Polls every tracked streamer once outside the schedule")
    public ResponseEntity<Map<String, String>> triggerTick() {
        NowLiveBackgroundService poller = backgroundService.getIfAvailable();
        if (poller == null || !poller.isRunning()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Now-live poller is not running"));
        }

        try {
            poller.triggerTick();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(Map.of("status", "completed"));
    }

    private static ResponseEntity<Map<String, String>> respond(HttpStatus status, StreamerManagementResult result,
                                                               String message) {
        return ResponseEntity.status(status).body(Map.of("result", result.name(), "message", message));
    }
}
