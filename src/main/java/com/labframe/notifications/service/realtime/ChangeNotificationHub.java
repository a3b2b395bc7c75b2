package com.labframe.notifications.service.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labframe.notifications.config.NotificationProperties;
import com.labframe.notifications.model.dto.ChangeNotification;
import com.labframe.notifications.service.NotificationMetricsService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fans change notifications out to the connected clients of a project.
 *
 * Every client owns a bounded {@link Subscription}. Broadcasting never waits:
 * when a client's queue is full the frame is dropped for that client only and
 * the client stays subscribed. Clients leave through {@link #unsubscribe}, which
 * their stream session calls once the connection is gone.
 *
 * A project entry exists only while it has at least one subscription; entry
 * creation and removal happen inside {@link ConcurrentMap#compute}.
 */
@Slf4j
@Component
public class ChangeNotificationHub {

    private final ConcurrentMap<String, Set<Subscription>> subscribers = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final NotificationMetricsService metrics;
    private final int queueCapacity;

    public ChangeNotificationHub(ObjectMapper objectMapper,
                                 NotificationProperties properties,
                                 NotificationMetricsService metrics) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.queueCapacity = properties.getSubscriberQueueCapacity();
        metrics.bindSubscriberGauge(this::totalSubscribers);
    }

    public Subscription subscribe(String project) {
        Subscription subscription = new Subscription(project, queueCapacity);
        subscribers.compute(project, (key, current) -> {
            Set<Subscription> target = current != null ? current : ConcurrentHashMap.newKeySet();
            target.add(subscription);
            return target;
        });
        log.debug("Subscribed {} to project '{}'", subscription, project);
        return subscription;
    }

    /**
     * Removes the subscription; a second call for the same subscription does nothing.
     */
    public void unsubscribe(Subscription subscription) {
        subscribers.computeIfPresent(subscription.getProject(), (key, current) -> {
            current.remove(subscription);
            return current.isEmpty() ? null : current;
        });
        log.debug("Unsubscribed {} from project '{}'", subscription, subscription.getProject());
    }

    /**
     * Serialises the message once and offers it to every subscriber of the project.
     *
     * @return The number of subscribers that accepted the frame.
     */
    public int broadcast(String project, ChangeNotification message) {
        Set<Subscription> targets = subscribers.get(project);
        if (targets == null || targets.isEmpty()) {
            log.debug("No subscribers for project '{}', skipping '{}'", project, message.type());
            return 0;
        }

        String frame = render(message);
        int delivered = 0;
        for (Subscription subscription : targets) {
            if (subscription.offer(frame)) {
                delivered++;
            } else {
                metrics.recordDropped();
                log.debug("Queue full, dropped '{}' for {} ({} dropped so far)",
                        message.type(), subscription, subscription.droppedCount());
            }
        }
        metrics.recordBroadcast();
        log.debug("Broadcast '{}' to {}/{} subscribers of project '{}'",
                message.type(), delivered, targets.size(), project);
        return delivered;
    }

    /**
     * @return The message as a complete data frame.
     */
    public String render(ChangeNotification message) {
        try {
            return SseFrames.data(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialise " + message, ex);
        }
    }

    public int subscriberCount(String project) {
        Set<Subscription> current = subscribers.get(project);
        return current == null ? 0 : current.size();
    }

    public boolean hasProject(String project) {
        return subscribers.containsKey(project);
    }

    /**
     * @return Live subscriber counts per project, sorted by project.
     */
    public Map<String, Integer> activeProjects() {
        Map<String, Integer> snapshot = new TreeMap<>();
        subscribers.forEach((project, current) -> snapshot.put(project, current.size()));
        return snapshot;
    }

    public int totalSubscribers() {
        return subscribers.values().stream().mapToInt(Set::size).sum();
    }

    @PreDestroy
    public void shutdown() {
        int remaining = totalSubscribers();
        if (remaining > 0) {
            log.info("Releasing {} remaining subscriptions", remaining);
        }
        subscribers.clear();
    }
}
