package com.phillippitts.speakstream.server.recognition;

import com.phillippitts.speakstream.exception.ModelNotFoundException;
import com.phillippitts.speakstream.exception.RecognizerException;

/**
 * Contract for speech recognizer implementations.
 * Implementations wrap a recognition library (Vosk JNI, whisper.cpp process) behind a single
 * call that maps normalized samples to a structured result.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Recognizer is constructed with configuration (model path, parameters)</li>
 *   <li>{@link #initialize()} loads the model (may throw {@link ModelNotFoundException})</li>
 *   <li>{@link #recognize(float[], int)} processes audio (may throw {@link RecognizerException})</li>
 *   <li>{@link #close()} releases resources when the recognizer is no longer needed</li>
 * </ol>
 *
 * <p>Result format: a JSON object
 * <pre>
 * {"text":"hello world",
 *  "timestamp":[{"text":"hello","timestamp":[0,480]},{"text":"world","timestamp":[480,900]}]}
 * </pre>
 * with segment offsets in milliseconds from the first submitted sample. The
 * {@link RecognitionDispatcher} tolerates missing or malformed segments but treats anything
 * other than a JSON object as an unexpected result shape.
 *
 * <p>Thread Safety: callers never invoke {@code recognize} concurrently; the dispatcher
 * serializes access through {@link RecognizerGuard}.
 */
public interface SpeechRecognizer extends AutoCloseable {

    /**
     * Loads the model and prepares the recognizer. Called once at application startup.
     *
     * @throws ModelNotFoundException if the model cannot be found
     * @throws RecognizerException if initialization fails for other reasons
     */
    void initialize();

    /**
     * Recognizes one block of mono audio.
     *
     * @param samples    normalized samples in [-1.0, 1.0], never empty
     * @param sampleRate sample rate of {@code samples} in Hz
     * @return raw structured result as a JSON document
     * @throws RecognizerException if recognition fails or the recognizer is not initialized
     */
    String recognize(float[] samples, int sampleRate);

    /**
     * @return engine identifier, e.g. "vosk" or "whisper"
     */
    String getEngineName();

    /**
     * @return true when initialized and not closed
     */
    boolean isHealthy();

    /**
     * Releases model and native resources. Idempotent.
     */
    @Override
    void close();
}
