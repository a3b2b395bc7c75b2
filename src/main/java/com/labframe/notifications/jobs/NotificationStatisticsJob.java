package com.labframe.notifications.jobs;

import com.labframe.notifications.service.NotificationMetricsService;
import com.labframe.notifications.service.realtime.ChangeDetectorRegistry;
import com.labframe.notifications.service.realtime.ChangeNotificationHub;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Logs change notification statistics for monitoring.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationStatisticsJob {

    private final NotificationMetricsService metrics;
    private final ChangeNotificationHub hub;
    private final ChangeDetectorRegistry detectorRegistry;

    @Scheduled(fixedRateString = "${labframe.notifications.statistics-log-rate-ms:300000}",
            initialDelayString = "${labframe.notifications.statistics-log-rate-ms:300000}")
    public void logNotificationStatistics() {
        Map<String, Integer> subscribers = hub.activeProjects();
        log.info("=== CHANGE NOTIFICATION STATISTICS ===");
        log.info("Projects polled: {}, Subscribers: {}", detectorRegistry.projects(), subscribers);
        log.info("Polls: {}, Detection failures: {}, Poll failures: {}",
                metrics.getPollCount(), metrics.getDetectionFailureCount(), metrics.getLoopFailureCount());
        log.info("Broadcasts: {}, Broadcast failures: {}, Dropped frames: {}",
                metrics.getBroadcastCount(), metrics.getBroadcastFailureCount(), metrics.getDroppedCount());
        log.info("======================================");

        if (metrics.getDroppedCount() > 0) {
            log.warn("{} frames were dropped for slow subscribers", metrics.getDroppedCount());
        }
    }
}
