package com.phillippitts.speakstream.server.recognition;

import com.phillippitts.speakstream.exception.RecognizerException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Serializes recognizer calls across all sessions.
 *
 * <p>The recognizer is a single shared instance, so at most one call runs at any time
 * system-wide. Waiting callers are served in arrival order (fair semaphore) and give up after
 * the configured timeout.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * guard.acquire(); // Blocks until permit available or timeout
 * try {
 *     // ... recognize ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe.
 */
public final class RecognizerGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String engineName;

    /**
     * @param timeoutMs  maximum time to wait for the recognizer in milliseconds
     * @param engineName engine name for error messages
     */
    public RecognizerGuard(long timeoutMs, String engineName) {
        this(new Semaphore(1, true), timeoutMs, engineName);
    }

    RecognizerGuard(Semaphore semaphore, long timeoutMs, String engineName) {
        this.semaphore = semaphore;
        this.timeoutMs = timeoutMs;
        this.engineName = engineName;
    }

    /**
     * Acquires the recognizer, blocking up to the configured timeout.
     *
     * @throws RecognizerException if the recognizer stays busy past the timeout
     *         or the thread is interrupted while waiting
     */
    public void acquire() {
        try {
            boolean acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new RecognizerException(
                    "recognizer busy after " + timeoutMs + "ms wait",
                    engineName
                );
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecognizerException(
                "interrupted while waiting for recognizer",
                engineName,
                e
            );
        }
    }

    /**
     * Releases a previously acquired permit. Call from a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
