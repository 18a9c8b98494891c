package com.bbthechange.tvguide.listener;

import com.bbthechange.tvguide.dto.event.ServiceLifecycleEvent;
import com.bbthechange.tvguide.dto.event.StreamerBatchEvent;
import com.bbthechange.tvguide.dto.event.StreamerErrorEvent;
import com.bbthechange.tvguide.model.TrackedStreamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Writes every poller notification to the application log.
 */
@Component
public class BroadcastLoggingListener implements BroadcastStateListener {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastLoggingListener.class);

    @Override
    public void onServiceStarted(ServiceLifecycleEvent event) {
        logger.info("Now-live service started");
    }

    @Override
    public void onServiceStarting(ServiceLifecycleEvent event) {
        logger.info("Now-live service starting");
    }

    @Override
    public void onServiceExiting(ServiceLifecycleEvent event) {
        logger.info("Now-live service exiting");
    }

    @Override
    public void onServiceExited(ServiceLifecycleEvent event) {
        logger.info("Now-live service exited");
    }

    @Override
    public void onStreamersDetectedLive(StreamerBatchEvent event) {
        for (TrackedStreamer streamer : event.streamers()) {
            logger.info("{} went live: {}", streamer.getLogin(),
                    streamer.getBroadcast() != null ? streamer.getBroadcast().getTitle() : "");
        }
    }

    @Override
    public void onStreamersEnded(StreamerBatchEvent event) {
        logger.info("Broadcast ended for {}", logins(event));
    }

    @Override
    public void onStreamersContinuing(StreamerBatchEvent event) {
        logger.debug("Still live: {}", logins(event));
    }

    @Override
    public void onStreamersMediaRefreshDue(StreamerBatchEvent event) {
        logger.debug("Media refresh due for {}", logins(event));
    }

    @Override
    public void onStreamerAdded(StreamerBatchEvent event) {
        logger.info("Added {}", logins(event));
    }

    @Override
    public void onStreamerRemoved(StreamerBatchEvent event) {
        logger.info("Removed {}", logins(event));
    }

    @Override
    public void onStreamerError(StreamerErrorEvent event) {
        logger.warn("Streamer {}: {} ({})", event.streamerId(), event.message(),
                event.error() != null ? event.error().getMessage() : "no cause");
    }

    private static String logins(StreamerBatchEvent event) {
        return event.streamers().stream()
                .map(TrackedStreamer::getLogin)
                .collect(Collectors.joining(", "));
    }
}
