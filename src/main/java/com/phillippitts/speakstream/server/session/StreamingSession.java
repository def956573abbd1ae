package com.phillippitts.speakstream.server.session;

import com.phillippitts.speakstream.util.SerialExecutor;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server-side state of one client connection: its buffer, its connection state and its own
 * serial executor.
 *
 * <p>All work for a session runs on {@link #submit(Runnable)}, one task at a time in arrival
 * order, so the buffer is only touched by one thread at a time and at most one dispatch per
 * session is in flight. The buffer mutators ({@link #append(byte[])}, {@link #flush()},
 * {@link #configure(int)}) must only be called from such a task.
 *
 * <p>The state, the snapshot fields and {@link #close()} are safe from any thread.
 */
public final class StreamingSession {

    private static final Logger LOG = LogManager.getLogger(StreamingSession.class);

    /** ThreadContext key carrying the session id for all log lines of a session. */
    public static final String MDC_SESSION_ID = "sessionId";

    private final String id;
    private final SessionBuffer buffer;
    private final SerialExecutor executor;
    private final ResultSink sink;
    private final Instant openedAt;
    private final AtomicLong dispatches = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.OPEN;
    private volatile int sampleRate;
    private volatile int bufferedBytes;

    public StreamingSession(String id, SessionBuffer buffer, SerialExecutor executor, ResultSink sink) {
        this.id = Objects.requireNonNull(id, "id");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.openedAt = Instant.now();
        this.sampleRate = buffer.sampleRate();
    }

    /**
     * Queues work behind everything already submitted for this session.
     *
     * @return false if the session is closed and the task was not queued
     */
    public boolean submit(Runnable task) {
        if (isClosed()) {
            return false;
        }
        try {
            executor.execute(() -> {
                try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_SESSION_ID, id)) {
                    if (isClosed()) {
                        LOG.debug("Skipping task for closed session");
                        return;
                    }
                    task.run();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            LOG.debug("Session {} no longer accepts work: {}", id, e.getMessage());
            return false;
        }
    }

    /** Appends a frame; returns the chunk to dispatch when the threshold was reached. */
    public Optional<AudioChunk> append(byte[] frame) {
        transition(ConnectionState.STREAMING);
        Optional<AudioChunk> chunk = buffer.append(frame);
        bufferedBytes = buffer.size();
        return chunk;
    }

    /** Cuts everything buffered for an eof, possibly nothing. */
    public AudioChunk flush() {
        AudioChunk chunk = buffer.flush();
        bufferedBytes = buffer.size();
        return chunk;
    }

    /** Applies a new sample rate to audio not yet dispatched. */
    public void configure(int newSampleRate) {
        buffer.configure(newSampleRate);
        sampleRate = newSampleRate;
        transition(ConnectionState.CONFIGURED);
    }

    public void recordDispatch() {
        dispatches.incrementAndGet();
    }

    /**
     * Marks the session closed and drops buffered audio without dispatching it. Idempotent.
     *
     * @return true on the first call
     */
    public boolean close() {
        synchronized (this) {
            if (state == ConnectionState.CLOSED) {
                return false;
            }
            state = ConnectionState.CLOSED;
        }
        executor.execute(() -> {
            int dropped = buffer.discard();
            bufferedBytes = 0;
            if (dropped > 0) {
                LOG.info("Session {} closed; discarded {} undispatched byte(s)", id, dropped);
            }
        });
        executor.shutdown();
        return true;
    }

    private synchronized void transition(ConnectionState next) {
        if (state != ConnectionState.CLOSED && state != next) {
            LOG.debug("Session {} {} -> {}", id, state, next);
            state = next;
        }
    }

    public String id() {
        return id;
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isClosed() {
        return state == ConnectionState.CLOSED;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public ResultSink sink() {
        return sink;
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(id, state, sampleRate, bufferedBytes, dispatches.get(), openedAt);
    }
}
