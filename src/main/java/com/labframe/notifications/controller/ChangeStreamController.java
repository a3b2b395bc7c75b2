package com.labframe.notifications.controller;

import com.labframe.notifications.config.NotificationProperties;
import com.labframe.notifications.service.ProjectResolver;
import com.labframe.notifications.service.realtime.ChangeDetectorRegistry;
import com.labframe.notifications.service.realtime.ChangeNotificationHub;
import com.labframe.notifications.service.realtime.ChangeStreamSession;
import com.labframe.notifications.service.realtime.EmitterEventSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.util.Map;

/**
 * Server-Sent Events stream of parameter value changes, per project.
 */
@Slf4j
@RestController
@RequestMapping("/events")
@RequiredArgsConstructor
public class ChangeStreamController {

    private final ChangeDetectorRegistry detectorRegistry;
    private final ChangeNotificationHub hub;
    private final ProjectResolver projectResolver;
    private final NotificationProperties properties;
    private final ThreadPoolTaskExecutor streamTaskExecutor;

    /**
     * Opens a long-lived stream for the project. The project's change detector
     * is registered before the client subscribes. Frames are written as plain
     * text so each one goes out exactly as the hub rendered it.
     */
    @GetMapping(path = "/database-changes", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<ResponseBodyEmitter> streamDatabaseChanges(
            @RequestParam(value = "project", required = false) String project,
            @RequestHeader(value = "X-Project", required = false) String headerProject) {
        String projectName = projectResolver.resolve(project, headerProject);
        log.info("📡 Change stream requested for project '{}'", projectName);
        detectorRegistry.ensureRegistered(projectName);

        ResponseBodyEmitter emitter = new ResponseBodyEmitter(0L);
        ChangeStreamSession session = new ChangeStreamSession(
                hub, projectName, new EmitterEventSink(emitter), properties.getHeartbeatInterval());
        try {
            streamTaskExecutor.execute(session);
        } catch (TaskRejectedException e) {
            log.warn("❌ Change stream limit of {} reached, rejecting project '{}'",
                    properties.getMaxConcurrentStreams(), projectName);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }

    /**
     * Live subscriber counts per project.
     */
    @GetMapping("/subscribers")
    public Map<String, Integer> subscribers() {
        return hub.activeProjects();
    }
}
