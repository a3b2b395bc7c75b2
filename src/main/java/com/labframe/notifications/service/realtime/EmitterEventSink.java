package com.labframe.notifications.service.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes pre-rendered frames through a {@link ResponseBodyEmitter}.
 *
 * The sink closes as soon as the container reports the async request as
 * completed, timed out or failed, so the session notices a dropped client on
 * its next connection check rather than on its next write.
 */
@Slf4j
public class EmitterEventSink implements EventSink {

    static final MediaType FRAME_TYPE = new MediaType(MediaType.TEXT_EVENT_STREAM, StandardCharsets.UTF_8);

    private final ResponseBodyEmitter emitter;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public EmitterEventSink(ResponseBodyEmitter emitter) {
        this.emitter = emitter;
        emitter.onCompletion(() -> open.set(false));
        emitter.onTimeout(() -> open.set(false));
        emitter.onError(ex -> {
            open.set(false);
            log.debug("Change stream transport failed: {}", ex.getMessage());
        });
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void send(String frame) throws IOException {
        if (!open.get()) {
            throw new IOException("Change stream already closed");
        }
        try {
            emitter.send(frame, FRAME_TYPE);
        } catch (IOException ex) {
            open.set(false);
            throw ex;
        } catch (IllegalStateException ex) {
            // the emitter completed between the check and the write
            open.set(false);
            throw new IOException("Change stream already closed", ex);
        }
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            emitter.complete();
        }
    }
}
