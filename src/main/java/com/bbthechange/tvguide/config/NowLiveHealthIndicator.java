package com.bbthechange.tvguide.config;

import com.bbthechange.tvguide.service.NowLiveService;
import com.bbthechange.tvguide.service.impl.NowLiveBackgroundService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Health indicator for the now-live poller.
 * Down when the poller is stopped or its last three ticks failed.
 */
@Component
public class NowLiveHealthIndicator implements HealthIndicator {

    static final int FAILED_TICKS_BEFORE_DOWN = 3;

    private final ObjectProvider<NowLiveBackgroundService> backgroundService;
    private final NowLiveService nowLiveService;

    public NowLiveHealthIndicator(ObjectProvider<NowLiveBackgroundService> backgroundService,
                                  NowLiveService nowLiveService) {
        this.backgroundService = backgroundService;
        this.nowLiveService = nowLiveService;
    }

    @Override
    public Health health() {
        NowLiveBackgroundService poller = backgroundService.getIfAvailable();
        if (poller == null) {
            return Health.unknown()
                    .withDetail("poller", "disabled")
                    .build();
        }

        Health.Builder builder = poller.isRunning() ? Health.up() : Health.down();
        if (poller.getConsecutiveFailures() >= FAILED_TICKS_BEFORE_DOWN) {
            builder = Health.down();
        }

        Instant lastTickAt = poller.getLastTickAt();
        builder.withDetail("running", poller.isRunning())
                .withDetail("trackedStreamers", nowLiveService.getTrackedStreamers().size())
                .withDetail("completedTicks", poller.getCompletedTicks())
                .withDetail("consecutiveFailures", poller.getConsecutiveFailures())
                .withDetail("lastTickAt", lastTickAt != null ? lastTickAt.toString() : "never");
        if (poller.getLastTickError() != null) {
            builder.withDetail("lastTickError", poller.getLastTickError());
        }
        return builder.build();
    }
}
