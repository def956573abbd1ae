package com.phillippitts.speakstream.server.recognition;

import com.phillippitts.speakstream.exception.RecognizerException;
import jakarta.annotation.PreDestroy;

/**
 * Base class for recognizers providing the initialize/close lifecycle and health state.
 *
 * <p>Template Method: subclasses implement {@link #doInitialize()}, {@link #doClose()},
 * {@link #recognize(float[], int)} and {@link #getEngineName()}.
 *
 * <p><b>Thread Safety:</b> state transitions are synchronized on {@link #lock}. Both
 * {@link #initialize()} and {@link #close()} are idempotent.
 */
public abstract class AbstractSpeechRecognizer implements SpeechRecognizer {

    /**
     * Guards {@link #initialized} and {@link #closed}.
     */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /**
     * Recognizer-specific initialization, called under {@link #lock}.
     *
     * @throws RecognizerException if initialization fails
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Recognizer-specific cleanup, called under {@link #lock}. Must not throw.
     */
    protected abstract void doClose();

    /**
     * @throws RecognizerException if the recognizer is not initialized or already closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new RecognizerException(
                    getEngineName() + " recognizer not initialized or closed",
                    getEngineName()
                );
            }
        }
    }

    /**
     * Wraps a failure with engine context, preserving {@link RecognizerException} as is.
     *
     * <pre>{@code
     * try {
     *     return runEngine(samples);
     * } catch (Exception e) {
     *     throw wrapFailure(e);
     * }
     * }</pre>
     */
    protected final RecognizerException wrapFailure(Exception exception) {
        if (exception instanceof RecognizerException re) {
            return re;
        }
        return new RecognizerException(
            getEngineName() + " recognition failed: " + exception.getMessage(),
            getEngineName(),
            exception
        );
    }
}
