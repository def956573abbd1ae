package com.phillippitts.speakstream.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and worker thread shutdown.
 *
 * <p>Used by the whisper process manager and the client capture and sender threads.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /** Time for stream gobbler threads to flush buffered output after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of gobbler threads during cleanup; they are daemon threads. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Time for the capture thread to return from its last read after the line is stopped.
     * Longer than the gobbler timeouts because the thread may be blocked on device I/O.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /** Time for the client sender thread to drain remaining frames and the eof marker. */
    public static final Duration SENDER_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private ProcessTimeouts() {
    }
}
