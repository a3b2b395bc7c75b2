package com.labframe.notifications.service.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labframe.notifications.config.NotificationProperties;
import com.labframe.notifications.model.dto.ChangeNotification;
import com.labframe.notifications.service.NotificationMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChangeNotificationHub Tests")
class ChangeNotificationHubTest {

    private static final Duration NO_WAIT = Duration.ZERO;

    private NotificationMetricsService metrics;
    private ChangeNotificationHub hub;

    @BeforeEach
    void setUp() {
        NotificationProperties properties = new NotificationProperties();
        properties.setSubscriberQueueCapacity(2);
        metrics = new NotificationMetricsService(new SimpleMeterRegistry());
        hub = new ChangeNotificationHub(new ObjectMapper(), properties, metrics);
    }

    private static ChangeNotification changed(String... parameters) {
        return ChangeNotification.parameterValuesChanged(List.of(parameters));
    }

    @Nested
    @DisplayName("Subscription bookkeeping")
    class BookkeepingTests {

        @Test
        @DisplayName("Broadcast without subscribers is a no-op and creates no entry")
        void broadcastWithoutSubscribers() {
            int delivered = hub.broadcast("lab1", changed("temperature"));

            assertThat(delivered).isZero();
            assertThat(hub.hasProject("lab1")).isFalse();
            assertThat(hub.activeProjects()).isEmpty();
        }

        @Test
        @DisplayName("Unsubscribing twice is a no-op and the last one removes the project entry")
        void unsubscribeIsIdempotent() {
            Subscription first = hub.subscribe("lab1");
            Subscription second = hub.subscribe("lab1");
            assertThat(hub.subscriberCount("lab1")).isEqualTo(2);

            hub.unsubscribe(first);
            hub.unsubscribe(first);
            assertThat(hub.subscriberCount("lab1")).isEqualTo(1);

            hub.unsubscribe(second);
            assertThat(hub.hasProject("lab1")).isFalse();
            assertThat(hub.broadcast("lab1", changed("temperature"))).isZero();
            assertThat(hub.hasProject("lab1")).isFalse();
        }

        @Test
        @DisplayName("Projects are isolated from each other")
        void projectsAreIsolated() throws InterruptedException {
            Subscription lab1 = hub.subscribe("lab1");
            Subscription lab2 = hub.subscribe("lab2");

            hub.broadcast("lab1", changed("temperature"));

            assertThat(lab1.poll(NO_WAIT)).contains("temperature");
            assertThat(lab2.poll(NO_WAIT)).isNull();
            assertThat(hub.activeProjects()).containsEntry("lab1", 1).containsEntry("lab2", 1);
        }

        @Test
        @DisplayName("Shutdown releases every subscription")
        void shutdownClearsRegistry() {
            hub.subscribe("lab1");
            hub.subscribe("lab2");

            hub.shutdown();

            assertThat(hub.totalSubscribers()).isZero();
            assertThat(hub.activeProjects()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Fan-out")
    class FanOutTests {

        @Test
        @DisplayName("Frames are rendered as event-stream data lines")
        void rendersDataFrame() throws InterruptedException {
            Subscription subscription = hub.subscribe("lab1");

            hub.broadcast("lab1", changed("humidity", "temperature"));

            assertThat(subscription.poll(NO_WAIT)).isEqualTo(
                    "data: {\"type\":\"parameter_values_changed\",\"parameters\":[\"humidity\",\"temperature\"]}\n\n");
            assertThat(hub.render(ChangeNotification.connected())).isEqualTo("data: {\"type\":\"connected\"}\n\n");
        }

        @Test
        @DisplayName("A stalled subscriber loses messages while another one receives all of them")
        void fullQueueDropsOnlyForThatSubscriber() throws InterruptedException {
            // Given one subscriber that never drains and one that always does
            Subscription stalled = hub.subscribe("lab1");
            Subscription healthy = hub.subscribe("lab1");
            List<String> received = new ArrayList<>();

            // When five messages are broadcast
            for (int i = 0; i < 5; i++) {
                hub.broadcast("lab1", changed("p" + i));
                received.add(healthy.poll(NO_WAIT));
            }

            // Then
            assertThat(received).hasSize(5).doesNotContainNull();
            assertThat(received.get(4)).contains("p4");
            assertThat(stalled.pending()).isEqualTo(2);
            assertThat(stalled.droppedCount()).isEqualTo(3);
            assertThat(stalled.poll(NO_WAIT)).contains("p0");
            assertThat(hub.subscriberCount("lab1")).isEqualTo(2);
            assertThat(metrics.getDroppedCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("A subscriber that catches up receives the next message")
        void drainedSubscriberReceivesAgain() throws InterruptedException {
            Subscription subscription = hub.subscribe("lab1");
            hub.broadcast("lab1", changed("a"));
            hub.broadcast("lab1", changed("b"));
            assertThat(hub.broadcast("lab1", changed("c"))).isZero();

            subscription.poll(NO_WAIT);
            subscription.poll(NO_WAIT);

            assertThat(hub.broadcast("lab1", changed("d"))).isEqualTo(1);
            assertThat(subscription.poll(NO_WAIT)).contains("\"d\"");
        }

        @Test
        @DisplayName("Messages reach a subscriber in broadcast order")
        void deliveryIsFifo() throws InterruptedException {
            Subscription subscription = hub.subscribe("lab1");
            hub.broadcast("lab1", changed("first"));
            hub.broadcast("lab1", changed("second"));

            assertThat(subscription.poll(NO_WAIT)).contains("first");
            assertThat(subscription.poll(NO_WAIT)).contains("second");
        }
    }

    @Test
    @DisplayName("Concurrent subscribe, unsubscribe and broadcast leave no entry behind")
    void concurrentChurnLeavesNoEntry() throws Exception {
        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        Subscription subscription = hub.subscribe("lab1");
                        hub.unsubscribe(subscription);
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    hub.broadcast("lab1", changed("temperature"));
                }
                return null;
            }));

            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(hub.hasProject("lab1")).isFalse();
        assertThat(hub.totalSubscribers()).isZero();
    }
}
