package com.phillippitts.speakstream.exception;

/**
 * Thrown when an audio file cannot be decoded into mono float samples
 * (unsupported container, unsupported sample encoding, truncated data).
 */
public class InvalidAudioException extends SpeakStreamException {

    private final String source;

    public InvalidAudioException(String source, String reason) {
        super("Invalid audio (" + source + "): " + reason);
        this.source = source;
    }

    public InvalidAudioException(String source, String reason, Throwable cause) {
        super("Invalid audio (" + source + "): " + reason, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
