package com.labframe.notifications.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
public class NotificationMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter pollCounter;
    private final Counter detectionFailureCounter;
    private final Counter loopFailureCounter;
    private final Counter broadcastCounter;
    private final Counter droppedCounter;
    private final Counter broadcastFailureCounter;

    public NotificationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.pollCounter = meterRegistry.counter("labframe.notifications.polls");
        this.detectionFailureCounter = meterRegistry.counter("labframe.notifications.detection.failures");
        this.loopFailureCounter = meterRegistry.counter("labframe.notifications.poll.failures");
        this.broadcastCounter = meterRegistry.counter("labframe.notifications.broadcasts");
        this.droppedCounter = meterRegistry.counter("labframe.notifications.dropped");
        this.broadcastFailureCounter = meterRegistry.counter("labframe.notifications.broadcast.failures");
    }

    /**
     * Publishes the number of live subscribers as a gauge.
     */
    public void bindSubscriberGauge(Supplier<Number> subscribers) {
        Gauge.builder("labframe.notifications.subscribers", subscribers)
                .description("Connected change stream clients")
                .register(meterRegistry);
    }

    public void recordPoll() {
        pollCounter.increment();
    }

    public void recordDetectionFailure() {
        detectionFailureCounter.increment();
        logger.debug("Recorded detection failure metric - Total: {}", (long) detectionFailureCounter.count());
    }

    public void recordLoopFailure() {
        loopFailureCounter.increment();
        logger.debug("Recorded poll failure metric - Total: {}", (long) loopFailureCounter.count());
    }

    public void recordBroadcast() {
        broadcastCounter.increment();
    }

    public void recordBroadcastFailure() {
        broadcastFailureCounter.increment();
        logger.debug("Recorded broadcast failure metric - Total: {}", (long) broadcastFailureCounter.count());
    }

    public void recordDropped() {
        droppedCounter.increment();
    }

    public long getPollCount() {
        return (long) pollCounter.count();
    }

    public long getDetectionFailureCount() {
        return (long) detectionFailureCounter.count();
    }

    public long getLoopFailureCount() {
        return (long) loopFailureCounter.count();
    }

    public long getBroadcastCount() {
        return (long) broadcastCounter.count();
    }

    public long getBroadcastFailureCount() {
        return (long) broadcastFailureCounter.count();
    }

    public long getDroppedCount() {
        return (long) droppedCounter.count();
    }
}
