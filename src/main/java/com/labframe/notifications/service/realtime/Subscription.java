package com.labframe.notifications.service.realtime;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One connected client's bounded FIFO of pending frames.
 *
 * Created by {@link ChangeNotificationHub#subscribe(String)} and owned by the hub;
 * the stream session only drains it. Equality is identity.
 */
public final class Subscription {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id = SEQUENCE.incrementAndGet();
    private final String project;
    private final BlockingQueue<String> queue;
    private final AtomicLong dropped = new AtomicLong();

    Subscription(String project, int capacity) {
        this.project = project;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public long getId() {
        return id;
    }

    public String getProject() {
        return project;
    }

    /**
     * Enqueues without waiting.
     *
     * @return false when the queue is full and the frame was dropped.
     */
    boolean offer(String frame) {
        if (queue.offer(frame)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    /**
     * Waits up to {@code timeout} for the next frame.
     *
     * @return The next frame, or null when none arrived in time.
     */
    public String poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int pending() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", project='" + project + "', pending=" + queue.size() + '}';
    }
}
