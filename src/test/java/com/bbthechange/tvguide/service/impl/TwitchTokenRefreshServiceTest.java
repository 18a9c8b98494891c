package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.client.TwitchAuthClient;
import com.bbthechange.tvguide.exception.TwitchApiException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TwitchTokenRefreshServiceTest {

    @Mock
    private TwitchAuthClient authClient;

    private MeterRegistry meterRegistry;
    private TwitchTokenRefreshService refreshService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        refreshService = new TwitchTokenRefreshService(authClient, meterRegistry);
    }

    @Test
    @DisplayName("should skip the refresh while the cached token is valid")
    void refreshToken_ValidToken_Skips() {
        // Given
        when(authClient.hasValidToken()).thenReturn(true);

        // When
        refreshService.refreshToken();

        // Then
        verify(authClient, never()).getAccessToken();
    }

    @Test
    @DisplayName("should fetch a token when none is cached")
    void refreshToken_NoToken_Fetches() {
        // Given
        when(authClient.hasValidToken()).thenReturn(false);
        when(authClient.getAccessToken()).thenReturn("token-123");

        // When
        refreshService.refreshToken();

        // Then
        verify(authClient).getAccessToken();
        assertThat(meterRegistry.counter("twitch_token_refresh_total", "status", "success").count()).isEqualTo(1.0);
        assertThat(refreshService.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should count failures without throwing and reset them on success")
    void refreshToken_FailuresThenSuccess_TracksConsecutiveFailures() {
        // Given
        when(authClient.hasValidToken()).thenReturn(false);
        when(authClient.getAccessToken())
                .thenThrow(TwitchApiException.serviceUnavailable("Twitch token endpoint unavailable", null))
                .thenThrow(TwitchApiException.serviceUnavailable("Twitch token endpoint unavailable", null))
                .thenReturn("token-123");

        // When
        refreshService.refreshToken();
        refreshService.refreshToken();

        // Then
        assertThat(refreshService.getConsecutiveFailures()).isEqualTo(2);
        assertThat(meterRegistry.counter("twitch_token_refresh_total", "status", "error").count()).isEqualTo(2.0);

        // When
        refreshService.refreshToken();

        // Then
        assertThat(refreshService.getConsecutiveFailures()).isZero();
    }
}
