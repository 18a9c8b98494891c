package com.bbthechange.tvguide.client;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.dto.twitch.TwitchStream;
import com.bbthechange.tvguide.dto.twitch.TwitchStreamsResponse;
import com.bbthechange.tvguide.dto.twitch.TwitchUser;
import com.bbthechange.tvguide.dto.twitch.TwitchUsersResponse;
import com.bbthechange.tvguide.exception.TwitchApiException;
import com.bbthechange.tvguide.service.StreamStatusSource;
import com.bbthechange.tvguide.service.StreamerLookup;
import com.bbthechange.tvguide.util.CancellationSignal;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Client for the Twitch Helix API.
 * Answers live-status queries for the poller and login lookups for roster management,
 * with retry logic for rate limiting and a single re-authentication on 401.
 */
@Component
public class TwitchHelixClient implements StreamStatusSource, StreamerLookup {

    private static final Logger logger = LoggerFactory.getLogger(TwitchHelixClient.class);

    static final int MAX_IDS_PER_REQUEST = 100;
    private static final String USER_AGENT = "TvGuide/1.0";
    private static final int MAX_RETRIES = 3;
    private static final long[] RETRY_DELAYS_MS = {2000, 3000, 4500}; // Exponential backoff

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TwitchAuthClient authClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    @Autowired
    public TwitchHelixClient(
            HttpClient externalHttpClient,
            ObjectMapper objectMapper,
            TwitchAuthClient authClient,
            TvGuideProperties properties) {
        this(externalHttpClient, objectMapper, authClient,
                properties.getTwitch().getHelixBaseUrl(), properties.getTwitch().getRequestTimeout());
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    TwitchHelixClient(HttpClient httpClient, ObjectMapper objectMapper, TwitchAuthClient authClient,
                      String baseUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.authClient = authClient;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Fetch the live streams for up to 100 user ids, following pagination.
     *
     * @throws IllegalArgumentException if more than 100 ids are given
     * @throws TwitchApiException if the API is unavailable
     * @throws CancellationException if cancelled or interrupted
     */
    @Override
    public List<TwitchStream> getLiveStreams(List<String> userIds, CancellationSignal cancellation) {
        if (userIds.size() > MAX_IDS_PER_REQUEST) {
            throw new IllegalArgumentException(
                    "At most " + MAX_IDS_PER_REQUEST + " user ids per request, got " + userIds.size());
        }
        if (userIds.isEmpty()) {
            return List.of();
        }

        String query = userIds.stream()
                .map(id -> "user_id=" + encode(id))
                .collect(Collectors.joining("&"));
        String baseQueryUrl = baseUrl + "/streams?" + query + "&type=live&first=" + MAX_IDS_PER_REQUEST;

        List<TwitchStream> streams = new ArrayList<>();
        String cursor = null;
        do {
            String url = cursor == null ? baseQueryUrl : baseQueryUrl + "&after=" + encode(cursor);
            TwitchStreamsResponse page = fetchWithRetry(url, TwitchStreamsResponse.class, cancellation);
            if (page.getData() == null || page.getData().isEmpty()) {
                break;
            }
            streams.addAll(page.getData());
            cursor = page.nextCursor();
        } while (cursor != null);

        logger.debug("Twitch reports {} of {} users live", streams.size(), userIds.size());
        return streams;
    }

    /**
     * Look up a user by login name.
     *
     * @return the user, or empty if Twitch does not know the login
     * @throws TwitchApiException if the login is blank or the API is unavailable
     */
    @Override
    public Optional<TwitchUser> findByLogin(String login, CancellationSignal cancellation) {
        if (login == null || login.isBlank()) {
            throw TwitchApiException.invalidRequest("Login must not be blank");
        }

        logger.info("Looking up Twitch user {}", login);

        String url = baseUrl + "/users?login=" + encode(login.trim());
        TwitchUsersResponse response = fetchWithRetry(url, TwitchUsersResponse.class, cancellation);

        if (response.getData() == null || response.getData().isEmpty()) {
            logger.info("No Twitch user found for login {}", login);
            return Optional.empty();
        }
        return Optional.of(response.getData().get(0));
    }

    /**
     * Execute a GET with retry logic for rate limiting (HTTP 429) and one token refresh on HTTP 401.
     */
    private <T> T fetchWithRetry(String url, Class<T> responseType, CancellationSignal cancellation) {
        int attempt = 0;
        boolean reauthenticated = false;
        Exception lastException = null;

        while (attempt < MAX_RETRIES) {
            cancellation.throwIfCancellationRequested();
            try {
                return fetch(url, responseType);
            } catch (TwitchApiException | CancellationException e) {
                throw e;
            } catch (RateLimitException e) {
                attempt++;
                lastException = e;

                if (attempt < MAX_RETRIES) {
                    long delayMs = RETRY_DELAYS_MS[attempt - 1];
                    logger.warn("Rate limited by Twitch (attempt {}/{}). Retrying in {}ms",
                            attempt, MAX_RETRIES, delayMs);
                    sleep(delayMs);
                }
            } catch (UnauthorizedException e) {
                if (reauthenticated) {
                    throw TwitchApiException.authenticationFailed("Twitch rejected a freshly issued access token", e);
                }
                reauthenticated = true;
                logger.warn("Twitch answered 401, refreshing access token and retrying");
                authClient.invalidate();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while calling Twitch");
            } catch (Exception e) {
                throw TwitchApiException.serviceUnavailable("Twitch API unavailable", e);
            }
        }

        throw TwitchApiException.serviceUnavailable(
                "Twitch API unavailable after " + MAX_RETRIES + " retries", lastException);
    }

    /**
     * Make HTTP request to the Helix API.
     */
    private <T> T fetch(String url, Class<T> responseType) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", USER_AGENT)
                .header("Authorization", "Bearer " + authClient.getAccessToken())
                .header("Client-Id", authClient.getClientId())
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        int statusCode = response.statusCode();
        logger.debug("Twitch API response status: {} for URL: {}", statusCode, url);

        if (statusCode == 429) {
            throw new RateLimitException("Rate limited by Twitch");
        }

        if (statusCode == 401) {
            throw new UnauthorizedException("Twitch rejected the access token");
        }

        if (statusCode < 200 || statusCode >= 300) {
            throw new RuntimeException("Twitch API returned status " + statusCode);
        }

        return objectMapper.readValue(response.body(), responseType);
    }

    /**
     * Sleep for the specified duration.
     * Package-private for testing.
     */
    void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for retry");
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Internal exception for rate limiting that triggers retry.
     */
    private static class RateLimitException extends RuntimeException {
        RateLimitException(String message) {
            super(message);
        }
    }

    /**
     * Internal exception for an expired or revoked token that triggers one re-authentication.
     */
    private static class UnauthorizedException extends RuntimeException {
        UnauthorizedException(String message) {
            super(message);
        }
    }
}
