package com.phillippitts.speakstream.server.recognition.whisper;

/**
 * Limits and fixed parameters for driving the whisper.cpp subprocess.
 */
final class WhisperConstants {

    /** Sample rate whisper.cpp requires for its WAV input. */
    static final int REQUIRED_SAMPLE_RATE = 16_000;

    /** Maximum bytes captured from stderr per call (256KB). */
    static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Maximum characters of stderr carried into an error message. */
    static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    /** Suffix whisper.cpp appends to the {@code -of} base name in JSON mode. */
    static final String JSON_SUFFIX = ".json";

    private WhisperConstants() {
    }
}
