package com.labframe.notifications.service.realtime;

import com.labframe.notifications.config.NotificationProperties;
import com.labframe.notifications.model.dto.ChangeNotification;
import com.labframe.notifications.service.NotificationMetricsService;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background task that polls every registered project for changes and
 * broadcasts the changed parameter names to the project's subscribers.
 *
 * Exactly one loop runs per application: it is started with the context and
 * stopped, then awaited, when the context closes. A failing project is logged
 * and skipped for the tick. A failing tick backs off before the next attempt.
 * Interruption ends the loop and is not treated as a failure.
 */
@Slf4j
@Component
public class DatabaseChangePoller implements SmartLifecycle {

    private final ChangeDetectorRegistry detectorRegistry;
    private final ChangeNotificationHub hub;
    private final NotificationMetricsService metrics;
    private final NotificationProperties properties;
    private final IntervalFunction errorBackoff;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executor;
    private Future<?> loop;

    public DatabaseChangePoller(ChangeDetectorRegistry detectorRegistry,
                                ChangeNotificationHub hub,
                                NotificationMetricsService metrics,
                                NotificationProperties properties) {
        this.detectorRegistry = detectorRegistry;
        this.hub = hub;
        this.metrics = metrics;
        this.properties = properties;
        this.errorBackoff = IntervalFunction.ofExponentialBackoff(
                properties.getErrorBackoff().toMillis(), 2.0, properties.getMaxErrorBackoff().toMillis());
    }

    @Override
    public void start() {
        if (!properties.isEnabled()) {
            log.info("Change poller disabled (labframe.notifications.enabled=false)");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("change-poller-"));
        loop = executor.submit(this::runLoop);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        loop.cancel(true);
        executor.shutdownNow();
        Duration timeout = properties.getShutdownTimeout();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Change poller did not stop within {}", timeout);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the change poller to stop");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return true once the poller thread has fully finished after {@link #stop()}.
     */
    public boolean isTerminated() {
        return executor == null || executor.isTerminated();
    }

    private void runLoop() {
        Duration interval = properties.getPollInterval();
        log.info("Change poller started, polling every {}", interval);
        int consecutiveFailures = 0;

        while (running.get()) {
            try {
                Thread.sleep(interval.toMillis());
                pollOnce();
                consecutiveFailures = 0;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException ex) {
                consecutiveFailures++;
                metrics.recordLoopFailure();
                long backoff = errorBackoff.apply(consecutiveFailures);
                log.error("Change poll failed ({} in a row), retrying in {} ms", consecutiveFailures, backoff, ex);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("Change poller stopped");
    }

    /**
     * Runs one detection per registered project and broadcasts every non-empty change set.
     *
     * @return The number of projects a change notification was broadcast for.
     */
    public int pollOnce() {
        metrics.recordPoll();
        int broadcasts = 0;
        for (ChangeDetector detector : detectorRegistry.detectors()) {
            DetectionResult result;
            try {
                result = detector.detectChanges();
            } catch (ChangeDetectionException ex) {
                metrics.recordDetectionFailure();
                log.warn(ex.getMessage());
                continue;
            } catch (RuntimeException ex) {
                metrics.recordDetectionFailure();
                log.warn("Unexpected error detecting changes for project '{}'", detector.getProject(), ex);
                continue;
            }

            if (!result.changed() || result.topics().isEmpty()) {
                continue;
            }
            log.info("Parameters changed in project '{}': {}", detector.getProject(), result.topics());
            try {
                hub.broadcast(detector.getProject(), ChangeNotification.parameterValuesChanged(result.topics()));
                broadcasts++;
            } catch (RuntimeException ex) {
                metrics.recordBroadcastFailure();
                log.error("Failed to broadcast changes of project '{}': {}", detector.getProject(), result.topics(), ex);
            }
        }
        return broadcasts;
    }
}
