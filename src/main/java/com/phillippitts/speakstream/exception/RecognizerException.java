package com.phillippitts.speakstream.exception;

/**
 * Thrown when a recognizer engine fails to produce a result.
 * This may occur due to engine errors, timeout, or an engine that is not loaded.
 *
 * <p>The dispatcher catches it per dispatch and turns it into a result carrying
 * an {@code error} field, so it never escapes a session.
 */
public class RecognizerException extends SpeakStreamException {

    private final String engineName;

    public RecognizerException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public RecognizerException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public RecognizerException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
