package com.phillippitts.speakstream.exception;

/**
 * Thrown when a control or result message cannot be decoded.
 *
 * <p>A protocol error never terminates the session: the offending message is logged and
 * skipped, and the connection keeps processing subsequent messages.
 */
public class ProtocolException extends SpeakStreamException {

    private final String payload;

    public ProtocolException(String message, String payload) {
        super(message);
        this.payload = payload;
    }

    public ProtocolException(String message, String payload, Throwable cause) {
        super(message, cause);
        this.payload = payload;
    }

    /** Raw message text that failed to decode (may be truncated by callers before logging). */
    public String getPayload() {
        return payload;
    }
}
