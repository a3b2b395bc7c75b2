package com.labframe.notifications.service.realtime;

import java.io.IOException;

/**
 * Outbound side of one client connection.
 */
public interface EventSink {

    /**
     * Cheap, non-blocking check of the connection state.
     */
    boolean isOpen();

    /**
     * Writes one complete frame and pushes it to the client.
     *
     * @throws IOException when the client is gone.
     */
    void send(String frame) throws IOException;

    /**
     * Ends the stream from the server side. Does nothing once the connection is closed.
     */
    void close();
}
