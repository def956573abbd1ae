package com.phillippitts.speakstream.exception;

/**
 * Thrown when the transport to the peer is closed or broken.
 * Terminates the affected session only.
 */
public class ConnectionException extends SpeakStreamException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
