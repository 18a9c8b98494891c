package com.bbthechange.tvguide.listener;

import com.bbthechange.tvguide.dto.event.ServiceLifecycleEvent;
import com.bbthechange.tvguide.dto.event.StreamerBatchEvent;
import com.bbthechange.tvguide.model.TrackedStreamer;
import com.bbthechange.tvguide.service.ActiveBroadcastService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reflects poller transitions in the Discord channel.
 * Enabled with tvguide.discord.enabled=true.
 */
@Component
@ConditionalOnProperty(name = "tvguide.discord.enabled", havingValue = "true")
public class ActiveBroadcastListener implements BroadcastStateListener {

    private static final Logger logger = LoggerFactory.getLogger(ActiveBroadcastListener.class);

    private final ActiveBroadcastService activeBroadcastService;

    public ActiveBroadcastListener(ActiveBroadcastService activeBroadcastService) {
        this.activeBroadcastService = activeBroadcastService;
    }

    @Override
    public void onServiceStarting(ServiceLifecycleEvent event) {
        activeBroadcastService.loadData(event.cancellation());
        activeBroadcastService.updateSummary(event.cancellation());
    }

    @Override
    public void onServiceExiting(ServiceLifecycleEvent event) {
        activeBroadcastService.updateSummary(event.cancellation());
    }

    @Override
    public void onStreamersDetectedLive(StreamerBatchEvent event) {
        activeBroadcastService.showLive(event.streamers(), false, event.cancellation());
        activeBroadcastService.updateSummary(event.cancellation());
    }

    @Override
    public void onStreamersContinuing(StreamerBatchEvent event) {
        // Summary links only change when messages come and go
        activeBroadcastService.showLive(event.streamers(), false, event.cancellation());
    }

    @Override
    public void onStreamersMediaRefreshDue(StreamerBatchEvent event) {
        activeBroadcastService.showLive(event.streamers(), true, event.cancellation());
        activeBroadcastService.updateSummary(event.cancellation());
    }

    @Override
    public void onStreamersEnded(StreamerBatchEvent event) {
        activeBroadcastService.showEnded(event.streamers(), event.cancellation());
        activeBroadcastService.updateSummary(event.cancellation());
    }

    @Override
    public void onStreamerRemoved(StreamerBatchEvent event) {
        List<TrackedStreamer> wereLive = event.streamers().stream()
                .filter(TrackedStreamer::isLive)
                .toList();
        if (wereLive.isEmpty()) {
            return;
        }
        logger.info("Finishing messages of {} removed streamers", wereLive.size());
        activeBroadcastService.showEnded(wereLive, event.cancellation());
        activeBroadcastService.updateSummary(event.cancellation());
    }
}
