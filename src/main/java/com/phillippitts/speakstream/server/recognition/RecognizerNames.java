package com.phillippitts.speakstream.server.recognition;

/**
 * Engine identifiers accepted by {@code speakstream.recognizer.engine} and used as metric tags.
 */
public final class RecognizerNames {

    public static final String VOSK = "vosk";
    public static final String WHISPER = "whisper";

    private RecognizerNames() {
    }
}
