package com.bbthechange.tvguide.client;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.dto.discord.DiscordMessageRequest;
import com.bbthechange.tvguide.dto.discord.DiscordMessageResponse;
import com.bbthechange.tvguide.exception.DiscordException;
import com.bbthechange.tvguide.util.CancellationSignal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Posts and edits messages through a Discord channel webhook.
 */
@Component
@ConditionalOnProperty(name = "tvguide.discord.enabled", havingValue = "true")
public class DiscordWebhookClient {

    private static final Logger logger = LoggerFactory.getLogger(DiscordWebhookClient.class);

    private static final int MAX_RETRIES = 3;
    private static final long[] RETRY_DELAYS_MS = {2000, 3000, 4500};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String webhookUrl;
    private final Duration requestTimeout;

    @Autowired
    public DiscordWebhookClient(HttpClient externalHttpClient, ObjectMapper objectMapper, TvGuideProperties properties) {
        this(externalHttpClient, objectMapper, properties.getDiscord().getWebhookUrl(),
                properties.getTwitch().getRequestTimeout());
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    DiscordWebhookClient(HttpClient httpClient, ObjectMapper objectMapper, String webhookUrl, Duration requestTimeout) {
        if (webhookUrl == null || webhookUrl.isBlank()) {
            throw new IllegalStateException("tvguide.discord.webhook-url must be set when Discord is enabled");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.webhookUrl = webhookUrl.endsWith("/") ? webhookUrl.substring(0, webhookUrl.length() - 1) : webhookUrl;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Post a new message and return it, including the id needed to edit it later.
     *
     * @throws DiscordException if Discord rejects the message or cannot be reached
     */
    public DiscordMessageResponse createMessage(DiscordMessageRequest message, CancellationSignal cancellation) {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(webhookUrl + "?wait=true"))
                .POST(HttpRequest.BodyPublishers.ofString(serialize(message)));
        DiscordMessageResponse response = sendWithRetry(request, cancellation);
        logger.debug("Created Discord message {}", response.getId());
        return response;
    }

    /**
     * Replace the content of a message previously posted by this webhook.
     *
     * @throws DiscordException with status 404 if the message no longer exists
     */
    public DiscordMessageResponse editMessage(String messageId, DiscordMessageRequest message,
                                              CancellationSignal cancellation) {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(webhookUrl + "/messages/" + messageId))
                .method("PATCH", HttpRequest.BodyPublishers.ofString(serialize(message)));
        DiscordMessageResponse response = sendWithRetry(request, cancellation);
        logger.debug("Edited Discord message {}", messageId);
        return response;
    }

    private DiscordMessageResponse sendWithRetry(HttpRequest.Builder builder, CancellationSignal cancellation) {
        HttpRequest request = builder
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .build();

        int attempt = 0;
        while (true) {
            cancellation.throwIfCancellationRequested();

            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while calling Discord");
            } catch (IOException e) {
                throw new DiscordException("Discord webhook unavailable", e);
            }

            int statusCode = response.statusCode();
            if (statusCode == 429) {
                attempt++;
                if (attempt >= MAX_RETRIES) {
                    throw new DiscordException(statusCode, "Rate limited by Discord after " + MAX_RETRIES + " attempts");
                }
                long delayMs = RETRY_DELAYS_MS[attempt - 1];
                logger.warn("Rate limited by Discord (attempt {}/{}). Retrying in {}ms", attempt, MAX_RETRIES, delayMs);
                sleep(delayMs);
                continue;
            }

            if (statusCode < 200 || statusCode >= 300) {
                throw new DiscordException(statusCode, "Discord webhook returned status " + statusCode);
            }

            try {
                return objectMapper.readValue(response.body(), DiscordMessageResponse.class);
            } catch (IOException e) {
                throw new DiscordException("Unreadable Discord response", e);
            }
        }
    }

    private String serialize(DiscordMessageRequest message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new DiscordException("Could not serialize Discord message", e);
        }
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
}
