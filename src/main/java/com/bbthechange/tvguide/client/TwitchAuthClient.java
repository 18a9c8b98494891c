package com.bbthechange.tvguide.client;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.dto.twitch.TwitchTokenResponse;
import com.bbthechange.tvguide.exception.TwitchApiException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Obtains and caches a Twitch app access token using the client-credentials grant.
 * The token is reused until {@code token-expiration-buffer} before Twitch says it expires.
 */
@Component
public class TwitchAuthClient {

    private static final Logger logger = LoggerFactory.getLogger(TwitchAuthClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TvGuideProperties.Twitch config;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile CachedToken cachedToken;

    @Autowired
    public TwitchAuthClient(HttpClient externalHttpClient, ObjectMapper objectMapper, TvGuideProperties properties) {
        this(externalHttpClient, objectMapper, properties.getTwitch(), Clock.systemUTC());
    }

    /**
     * Constructor for testing with a fixed clock.
     */
    TwitchAuthClient(HttpClient httpClient, ObjectMapper objectMapper, TvGuideProperties.Twitch config, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Get a valid access token, requesting a new one if the cached token is missing or about to expire.
     *
     * @throws TwitchApiException if Twitch rejects the credentials or cannot be reached
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public String getAccessToken() {
        CachedToken current = cachedToken;
        if (current != null && current.isValidAt(clock.instant())) {
            return current.value();
        }

        try {
            refreshLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for Twitch token");
        }
        try {
            // Another thread may have refreshed while we waited
            current = cachedToken;
            if (current != null && current.isValidAt(clock.instant())) {
                return current.value();
            }
            cachedToken = requestToken();
            return cachedToken.value();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drop the cached token, e.g. after Helix answered 401.
     */
    public void invalidate() {
        logger.info("Invalidating cached Twitch access token");
        cachedToken = null;
    }

    public boolean hasValidToken() {
        CachedToken current = cachedToken;
        return current != null && current.isValidAt(clock.instant());
    }

    public String getClientId() {
        return config.getClientId();
    }

    private CachedToken requestToken() {
        if (isBlank(config.getClientId()) || isBlank(config.getClientSecret())) {
            throw TwitchApiException.authenticationFailed("Twitch client credentials are not configured", null);
        }

        String form = "client_id=" + encode(config.getClientId())
                + "&client_secret=" + encode(config.getClientSecret())
                + "&grant_type=client_credentials";

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.getAuthBaseUrl() + "/token"))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .timeout(config.getRequestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while requesting Twitch token");
        } catch (IOException e) {
            throw TwitchApiException.serviceUnavailable("Twitch token endpoint unavailable", e);
        }

        int statusCode = response.statusCode();
        if (statusCode == 400 || statusCode == 401 || statusCode == 403) {
            throw TwitchApiException.authenticationFailed(
                    "Twitch rejected client credentials with status " + statusCode, null);
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw TwitchApiException.serviceUnavailable("Twitch token endpoint returned status " + statusCode, null);
        }

        TwitchTokenResponse token;
        try {
            token = objectMapper.readValue(response.body(), TwitchTokenResponse.class);
        } catch (IOException e) {
            throw TwitchApiException.serviceUnavailable("Unreadable Twitch token response", e);
        }
        if (token.getAccessToken() == null) {
            throw TwitchApiException.serviceUnavailable("Twitch token response had no access_token", null);
        }

        long lifetimeSeconds = token.getExpiresIn() != null ? token.getExpiresIn() : 0L;
        Instant expiresAt = clock.instant()
                .plusSeconds(lifetimeSeconds)
                .minus(config.getTokenExpirationBuffer());

        logger.info("Obtained Twitch access token valid for {} seconds", lifetimeSeconds);
        return new CachedToken(token.getAccessToken(), expiresAt);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record CachedToken(String value, Instant expiresAt) {
        boolean isValidAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
