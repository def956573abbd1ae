package com.phillippitts.speakstream.server.session;

import com.phillippitts.speakstream.audio.PcmFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-connection accumulation of raw audio and the byte-count dispatch policy.
 *
 * <p>{@link #append(byte[])} cuts a chunk as soon as the buffered length reaches the threshold
 * (32000 bytes by default, about one second of 16 kHz mono audio). The cut ignores silence and
 * word boundaries, so a word may be split across two dispatches.
 *
 * <p>Chunks are always whole samples. An odd trailing byte stays in the buffer and is joined
 * with the next frame; on {@link #flush()} it is discarded since no further audio will follow it.
 *
 * <p>Not thread-safe. A buffer is owned by exactly one {@link StreamingSession} and only
 * touched from that session's serial executor.
 */
public final class SessionBuffer {

    private static final Logger LOG = LogManager.getLogger(SessionBuffer.class);

    private final String sessionId;
    private final int thresholdBytes;
    private final ByteArrayOutputStream buffer;
    private int sampleRate;

    public SessionBuffer(String sessionId, int thresholdBytes, int initialSampleRate) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        if (thresholdBytes < PcmFormat.BLOCK_ALIGN) {
            throw new IllegalArgumentException("thresholdBytes must be at least " + PcmFormat.BLOCK_ALIGN);
        }
        if (initialSampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        this.thresholdBytes = thresholdBytes;
        this.sampleRate = initialSampleRate;
        this.buffer = new ByteArrayOutputStream(thresholdBytes + 4096);
    }

    /**
     * Appends one binary frame.
     *
     * @param frame raw PCM16LE bytes of any length
     * @return the whole buffer as a chunk when the threshold was reached, empty otherwise
     */
    public Optional<AudioChunk> append(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        buffer.write(frame, 0, frame.length);
        if (buffer.size() < thresholdBytes) {
            return Optional.empty();
        }
        LOG.debug("Session {} buffer reached threshold: {} bytes", sessionId, buffer.size());
        return Optional.of(cut(AudioChunk.Trigger.THRESHOLD));
    }

    /**
     * Submits whatever is buffered, possibly nothing, and resets the buffer.
     */
    public AudioChunk flush() {
        AudioChunk chunk = cut(AudioChunk.Trigger.EOF);
        if (buffer.size() > 0) {
            LOG.warn("Session {} discarding {} dangling byte(s) at eof", sessionId, buffer.size());
            buffer.reset();
        }
        return chunk;
    }

    /** Changes the rate for subsequent chunks. Bytes already buffered are kept. */
    public void configure(int newSampleRate) {
        if (newSampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + newSampleRate);
        }
        this.sampleRate = newSampleRate;
    }

    /** Discards everything buffered without dispatching it. */
    public int discard() {
        int dropped = buffer.size();
        buffer.reset();
        return dropped;
    }

    public int size() {
        return buffer.size();
    }

    public int sampleRate() {
        return sampleRate;
    }

    private AudioChunk cut(AudioChunk.Trigger trigger) {
        byte[] all = buffer.toByteArray();
        int aligned = all.length - (all.length % PcmFormat.BLOCK_ALIGN);
        buffer.reset();
        byte[] pcm = all;
        if (aligned != all.length) {
            pcm = new byte[aligned];
            System.arraycopy(all, 0, pcm, 0, aligned);
            buffer.write(all, aligned, all.length - aligned);
        }
        return new AudioChunk(sessionId, pcm, sampleRate, trigger);
    }
}
