package com.phillippitts.speakstream.server.session;

import com.phillippitts.speakstream.exception.ConnectionException;

/**
 * Outbound half of a connection: delivers encoded result messages to the client.
 */
public interface ResultSink {

    /**
     * @param payload encoded result message
     * @throws ConnectionException if the transport is closed or the write fails
     */
    void sendText(String payload);

    boolean isOpen();
}
