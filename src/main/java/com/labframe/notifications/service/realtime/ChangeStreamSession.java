package com.labframe.notifications.service.realtime;

import com.labframe.notifications.model.dto.ChangeNotification;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;

/**
 * Serves one client's change stream.
 *
 * <pre>
 * CONNECTING -- subscribed, "connected" frame written --> STREAMING
 * STREAMING  -- client gone / write failed / interrupted --> CLOSED
 * </pre>
 *
 * While streaming, each iteration checks the connection, then waits up to the
 * heartbeat interval for a queued frame and writes either that frame or a
 * heartbeat comment. The subscription is released and the sink closed on
 * every exit path.
 */
@Slf4j
public class ChangeStreamSession implements Runnable {

    public enum State {
        CONNECTING, STREAMING, CLOSED
    }

    private final ChangeNotificationHub hub;
    private final String project;
    private final EventSink sink;
    private final Duration heartbeatInterval;

    private volatile State state = State.CONNECTING;

    public ChangeStreamSession(ChangeNotificationHub hub, String project, EventSink sink, Duration heartbeatInterval) {
        this.hub = hub;
        this.project = project;
        this.sink = sink;
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public void run() {
        Subscription subscription = hub.subscribe(project);
        log.info("Change stream opened for project '{}' ({})", project, subscription.getId());
        try {
            sink.send(hub.render(ChangeNotification.connected()));
            state = State.STREAMING;

            while (sink.isOpen()) {
                String frame = subscription.poll(heartbeatInterval);
                sink.send(frame != null ? frame : SseFrames.HEARTBEAT);
            }
            log.debug("Client of project '{}' disconnected", project);
        } catch (IOException ex) {
            log.debug("Change stream for project '{}' closed by client: {}", project, ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.debug("Change stream for project '{}' interrupted", project);
        } finally {
            state = State.CLOSED;
            hub.unsubscribe(subscription);
            sink.close();
            log.info("Change stream closed for project '{}' ({}, {} dropped)",
                    project, subscription.getId(), subscription.droppedCount());
        }
    }

    public State getState() {
        return state;
    }

    public String getProject() {
        return project;
    }
}
