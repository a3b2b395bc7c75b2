package com.labframe.notifications.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for change polling and the event stream.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "labframe.notifications")
public class NotificationProperties {

    /** Start the background change poller with the application. */
    private boolean enabled = true;

    /** Delay between two poll ticks. */
    private Duration pollInterval = Duration.ofSeconds(3);

    /** Longest idle period on a stream before a heartbeat comment is written. */
    private Duration heartbeatInterval = Duration.ofSeconds(1);

    /** First backoff after a failed poll tick; doubles on consecutive failures. */
    private Duration errorBackoff = Duration.ofSeconds(3);

    /** Upper bound for the poll tick backoff. */
    private Duration maxErrorBackoff = Duration.ofSeconds(30);

    /** How long shutdown waits for the poller thread to finish. */
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    /** Pending frames kept per subscriber before new ones are dropped. */
    private int subscriberQueueCapacity = 100;

    /** Streams served at the same time; further requests are rejected. */
    private int maxConcurrentStreams = 64;

    /** Project used when a request names none. */
    private String defaultProject = "default";
}
