package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.listener.BroadcastStateListener;
import com.bbthechange.tvguide.service.NowLiveService;
import com.bbthechange.tvguide.util.CancellationSignal;
import com.bbthechange.tvguide.util.CancellationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the now-live poller for the lifetime of the application.
 *
 * On start the roster is loaded on a dedicated thread and a tick is scheduled every
 * {@code tvguide.now-live.update-interval}. On stop the in-flight tick is cancelled, the roster is saved
 * one last time without cancellation, and listeners are told the service has exited.
 * Enabled by default; disable with tvguide.now-live.enabled=false.
 */
@Service
@ConditionalOnProperty(name = "tvguide.now-live.enabled", havingValue = "true", matchIfMissing = true)
public class NowLiveBackgroundService implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(NowLiveBackgroundService.class);

    private final NowLiveService nowLiveService;
    private final List<BroadcastStateListener> listeners;
    private final Duration updateInterval;
    private final Duration shutdownTimeout;
    private final Object lifecycleMonitor = new Object();

    private volatile boolean running;
    private boolean listenersRegistered;
    private ScheduledExecutorService executor;
    private volatile CancellationSource cancellationSource;
    private volatile ScheduledFuture<?> tickFuture;

    private volatile Instant lastTickAt;
    private volatile String lastTickError;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong completedTicks = new AtomicLong();

    @Autowired
    public NowLiveBackgroundService(
            NowLiveService nowLiveService,
            List<BroadcastStateListener> listeners,
            TvGuideProperties properties) {
        this(nowLiveService, listeners,
                properties.getNowLive().getUpdateInterval(),
                properties.getNowLive().getShutdownTimeout());
    }

    /**
     * Constructor for testing with short intervals.
     */
    NowLiveBackgroundService(
            NowLiveService nowLiveService,
            List<BroadcastStateListener> listeners,
            Duration updateInterval,
            Duration shutdownTimeout) {
        this.nowLiveService = nowLiveService;
        this.listeners = List.copyOf(listeners);
        this.updateInterval = updateInterval;
        this.shutdownTimeout = shutdownTimeout;
        registerListeners();
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) {
                return;
            }
            registerListeners();

            CancellationSource source = new CancellationSource();
            cancellationSource = source;
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "now-live-poller");
                thread.setDaemon(true);
                return thread;
            });
            running = true;

            logger.info("Starting now-live poller with update interval {}s", updateInterval.toSeconds());
            nowLiveService.notifyServiceStarted();
            executor.execute(() -> runStartup(source));
        }
    }

    private void runStartup(CancellationSource source) {
        try {
            nowLiveService.notifyServiceStarting(source);
            nowLiveService.loadRoster(source);

            source.throwIfCancellationRequested();
            long intervalMs = updateInterval.toMillis();
            tickFuture = executor.scheduleWithFixedDelay(
                    () -> runTick(source), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            logger.info("Now-live poller running");
        } catch (CancellationException e) {
            logger.info("Now-live poller startup cancelled");
        } catch (Exception e) {
            logger.error("Now-live poller failed to start", e);
        }
    }

    private void runTick(CancellationSignal cancellation) {
        try {
            nowLiveService.tick(cancellation);
            recordSuccess();
        } catch (CancellationException e) {
            logger.debug("Now-live tick cancelled");
        } catch (Exception e) {
            // Keep the schedule alive, the next tick retries the save
            logger.error("Now-live tick failed", e);
            recordFailure(e);
        }
    }

    /**
     * Run one tick on the calling thread.
     *
     * @throws IllegalStateException if the poller is not running
     */
    public void triggerTick() {
        CancellationSource source = cancellationSource;
        if (!running || source == null) {
            throw new IllegalStateException("Now-live poller is not running");
        }

        logger.info("Running on-demand now-live tick");
        try {
            nowLiveService.tick(source);
            recordSuccess();
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            recordFailure(e);
            throw e;
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            running = false;
            logger.info("Stopping now-live poller");

            try {
                cancellationSource.cancel();
                ScheduledFuture<?> future = tickFuture;
                if (future != null) {
                    future.cancel(true);
                }
                awaitExecutorShutdown();

                nowLiveService.notifyServiceExiting(CancellationSignal.NONE);
                try {
                    nowLiveService.saveRoster(CancellationSignal.NONE);
                    logger.info("Final roster save complete");
                } catch (Exception e) {
                    logger.error("Final roster save failed", e);
                }
            } finally {
                try {
                    nowLiveService.notifyServiceExited();
                } finally {
                    unregisterListeners();
                    tickFuture = null;
                    logger.info("Now-live poller stopped");
                }
            }
        }
    }

    private void awaitExecutorShutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Now-live poller did not stop within {}s, forcing shutdown", shutdownTimeout.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void registerListeners() {
        if (!listenersRegistered) {
            listeners.forEach(nowLiveService::registerListener);
            listenersRegistered = true;
        }
    }

    private void unregisterListeners() {
        listeners.forEach(nowLiveService::unregisterListener);
        listenersRegistered = false;
    }

    private void recordSuccess() {
        lastTickAt = Instant.now();
        lastTickError = null;
        consecutiveFailures.set(0);
        completedTicks.incrementAndGet();
    }

    private void recordFailure(Exception e) {
        lastTickAt = Instant.now();
        lastTickError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        consecutiveFailures.incrementAndGet();
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }

    public String getLastTickError() {
        return lastTickError;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public long getCompletedTicks() {
        return completedTicks.get();
    }

    public Duration getUpdateInterval() {
        return updateInterval;
    }
}
