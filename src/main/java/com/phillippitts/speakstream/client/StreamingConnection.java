package com.phillippitts.speakstream.client;

import com.phillippitts.speakstream.exception.ConnectionException;

/**
 * Outbound side of the client's streaming connection.
 *
 * <p>Sends complete before returning, so a single caller observes wire order. Callers must not
 * send concurrently.
 */
public interface StreamingConnection extends AutoCloseable {

    /**
     * @throws ConnectionException if the connection is closed or the send fails
     */
    void sendText(String message);

    /**
     * @throws ConnectionException if the connection is closed or the send fails
     */
    void sendBinary(byte[] audio);

    boolean isOpen();

    @Override
    void close();
}
