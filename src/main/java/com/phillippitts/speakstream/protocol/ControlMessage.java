package com.phillippitts.speakstream.protocol;

/**
 * Structured text message sent from client to server.
 *
 * <p>Known types are {@link ConfigMessage} and {@link EofMessage}. Anything else decodes to
 * {@link UnknownControlMessage}, which the server logs and ignores.
 */
public interface ControlMessage {

    /** Value of the {@code type} field on the wire. */
    String type();

    /** {@code {"type":"config","sample_rate":<int>}} */
    record ConfigMessage(int sampleRate) implements ControlMessage {

        public static final String TYPE = "config";

        public ConfigMessage {
            if (sampleRate <= 0) {
                throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
            }
        }

        @Override
        public String type() {
            return TYPE;
        }
    }

    /** {@code {"type":"eof"}}: submit whatever is buffered. */
    record EofMessage() implements ControlMessage {

        public static final String TYPE = "eof";

        @Override
        public String type() {
            return TYPE;
        }
    }

    /** Well-formed control message whose type is not understood. */
    record UnknownControlMessage(String type) implements ControlMessage {
    }
}
