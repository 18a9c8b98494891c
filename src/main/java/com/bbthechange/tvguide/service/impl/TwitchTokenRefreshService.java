package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.client.TwitchAuthClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps the Twitch app access token warm so poll ticks rarely pay for a token request.
 * Enabled by default; disable with tvguide.twitch.token-refresh.enabled=false.
 */
@Service
@ConditionalOnProperty(name = "tvguide.twitch.token-refresh.enabled", havingValue = "true", matchIfMissing = true)
public class TwitchTokenRefreshService {

    private static final Logger logger = LoggerFactory.getLogger(TwitchTokenRefreshService.class);

    private final TwitchAuthClient authClient;
    private final MeterRegistry meterRegistry;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public TwitchTokenRefreshService(TwitchAuthClient authClient, MeterRegistry meterRegistry) {
        this.authClient = authClient;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Refresh the token if it is missing or inside its expiry buffer.
     * Runs every 5 minutes by default (configurable via tvguide.twitch.token-refresh.interval-ms).
     */
    @Scheduled(fixedDelayString = "${tvguide.twitch.token-refresh.interval-ms:300000}",
            initialDelayString = "${tvguide.twitch.token-refresh.initial-delay-ms:5000}")
    public void refreshToken() {
        if (authClient.hasValidToken()) {
            logger.debug("Twitch access token still valid, skipping refresh");
            return;
        }

        try {
            authClient.getAccessToken();
            int previousFailures = consecutiveFailures.getAndSet(0);
            if (previousFailures > 0) {
                logger.info("Twitch token refresh recovered after {} failures", previousFailures);
            }
            meterRegistry.counter("twitch_token_refresh_total", "status", "success").increment();
        } catch (Exception e) {
            int failures = consecutiveFailures.incrementAndGet();
            logger.error("Twitch token refresh failed ({} consecutive failures)", failures, e);
            meterRegistry.counter("twitch_token_refresh_total", "status", "error").increment();
        }
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
