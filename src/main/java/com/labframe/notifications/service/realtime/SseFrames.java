package com.labframe.notifications.service.realtime;

/**
 * Text framing of the change stream: one unit per message, each terminated by a blank line.
 */
public final class SseFrames {

    /** Comment frame; event-stream clients ignore it. */
    public static final String HEARTBEAT = ": heartbeat\n\n";

    private SseFrames() {
    }

    public static String data(String json) {
        return "data: " + json + "\n\n";
    }
}
