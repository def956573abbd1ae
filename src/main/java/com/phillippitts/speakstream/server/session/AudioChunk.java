package com.phillippitts.speakstream.server.session;

import java.util.Objects;

/**
 * Audio handed from a session buffer to the recognizer in one dispatch.
 *
 * @param sessionId  owning session
 * @param pcm        PCM16LE mono bytes, length always a multiple of two (may be empty)
 * @param sampleRate sample rate in effect when the chunk was cut
 * @param trigger    why the chunk was cut
 */
public record AudioChunk(String sessionId, byte[] pcm, int sampleRate, Trigger trigger) {

    /** Reason a dispatch was started. */
    public enum Trigger {
        /** Accumulated bytes reached the dispatch threshold. */
        THRESHOLD,
        /** Client sent an {@code eof} control message. */
        EOF
    }

    public AudioChunk {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(pcm, "pcm");
        Objects.requireNonNull(trigger, "trigger");
    }

    public boolean isEmpty() {
        return pcm.length == 0;
    }

    public int size() {
        return pcm.length;
    }
}
