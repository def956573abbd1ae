package com.phillippitts.speakstream.server.recognition;

import com.phillippitts.speakstream.audio.PcmConverter;
import com.phillippitts.speakstream.config.properties.RecognizerProperties;
import com.phillippitts.speakstream.domain.RecognitionResult;
import com.phillippitts.speakstream.exception.RecognizerException;
import com.phillippitts.speakstream.server.session.AudioChunk;
import com.phillippitts.speakstream.util.LogSanitizer;
import com.phillippitts.speakstream.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Turns buffered PCM into a {@link RecognitionResult} by calling the shared recognizer.
 *
 * <p>Steps per dispatch:
 * <ol>
 *   <li>Convert PCM16LE to floats (sample / 32768)</li>
 *   <li>Wait for the {@link RecognizerGuard}; one recognizer call runs system-wide</li>
 *   <li>Parse the structured output with {@link RecognizerOutputParser}</li>
 * </ol>
 *
 * <p>Never throws for recognizer problems: failures, a busy or unhealthy recognizer and
 * unexpected output all become {@link RecognitionResult#failure(String)}. An empty chunk
 * yields an empty result without touching the recognizer.
 *
 * <p>{@link #dispatchAsync(AudioChunk, Consumer)} runs dispatches on the recognition executor,
 * a single worker, so callers never block on the recognizer and results are delivered in
 * submission order.
 */
@Service
@Profile("!client")
public class RecognitionDispatcher {

    private static final Logger LOG = LogManager.getLogger(RecognitionDispatcher.class);

    private final SpeechRecognizer recognizer;
    private final RecognizerGuard guard;
    private final RecognitionMetrics metrics;
    private final Executor recognitionExecutor;

    @Autowired
    public RecognitionDispatcher(SpeechRecognizer recognizer,
                                 RecognizerProperties properties,
                                 RecognitionMetrics metrics,
                                 @Qualifier("recognitionExecutor") Executor recognitionExecutor) {
        this(recognizer, new RecognizerGuard(properties.getAcquireTimeoutMs(), recognizer.getEngineName()),
                metrics, recognitionExecutor);
    }

    /**
     * Dispatcher whose asynchronous dispatches run on the calling thread.
     */
    public RecognitionDispatcher(SpeechRecognizer recognizer,
                                 RecognizerProperties properties,
                                 RecognitionMetrics metrics) {
        this(recognizer, properties, metrics, Runnable::run);
    }

    RecognitionDispatcher(SpeechRecognizer recognizer, RecognizerGuard guard, RecognitionMetrics metrics,
                          Executor recognitionExecutor) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.recognitionExecutor = Objects.requireNonNull(recognitionExecutor, "recognitionExecutor");
    }

    /**
     * Queues a chunk for recognition and hands the result to {@code onResult} on the
     * recognition worker. Chunks are recognized and delivered in the order they were queued.
     * If the worker no longer accepts work, {@code onResult} receives a failure result on the
     * calling thread.
     */
    public void dispatchAsync(AudioChunk chunk, Consumer<RecognitionResult> onResult) {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(onResult, "onResult");
        try {
            recognitionExecutor.execute(() -> onResult.accept(dispatch(chunk)));
        } catch (RejectedExecutionException e) {
            LOG.warn("Recognition worker rejected {} bytes from session {}: {}",
                    chunk.size(), chunk.sessionId(), e.getMessage());
            onResult.accept(RecognitionResult.failure("recognizer shutting down"));
        }
    }

    /**
     * Recognizes one chunk cut from a session buffer.
     *
     * @param chunk whole-sample PCM16LE audio, possibly empty
     * @return result to send to the client; never null
     */
    public RecognitionResult dispatch(AudioChunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (chunk.isEmpty()) {
            LOG.warn("Session {} dispatched an empty buffer ({}); skipping recognizer", chunk.sessionId(),
                    chunk.trigger());
            return RecognitionResult.empty();
        }
        LOG.debug("Dispatching {} bytes @ {} Hz ({})", chunk.size(), chunk.sampleRate(), chunk.trigger());
        metrics.recordAudioBytes(recognizer.getEngineName(), chunk.size());
        return recognize(PcmConverter.toFloatSamples(chunk.pcm()), chunk.sampleRate());
    }

    /**
     * Recognizes normalized samples. Entry point shared by streaming sessions and batch mode.
     */
    public RecognitionResult recognize(float[] samples, int sampleRate) {
        Objects.requireNonNull(samples, "samples");
        if (samples.length == 0) {
            return RecognitionResult.empty();
        }
        String engine = recognizer.getEngineName();
        try {
            guard.acquire();
        } catch (RecognizerException e) {
            LOG.error("Recognizer unavailable: {}", e.getMessage());
            metrics.incrementFailure(engine, "busy");
            return RecognitionResult.failure(e.getMessage());
        }
        long startTime = System.nanoTime();
        try {
            if (!recognizer.isHealthy()) {
                throw new RecognizerException("recognizer not available", engine);
            }
            String raw = recognizer.recognize(samples, sampleRate);
            RecognitionResult result = RecognizerOutputParser.parse(raw);
            if (result.isFailure()) {
                metrics.incrementFailure(engine, "shape");
                return result;
            }
            metrics.incrementSuccess(engine);
            LOG.info("Recognized {} ms of audio in {} ms (chars={}, segments={})",
                    TimeUtils.audioMillis(samples.length, sampleRate), TimeUtils.elapsedMillis(startTime),
                    result.text().length(), result.segments().size());
            LOG.debug("Recognized text: {}", LogSanitizer.preview(result.text()));
            return result;
        } catch (RuntimeException e) {
            LOG.error("Recognition failed on {} samples @ {} Hz", samples.length, sampleRate, e);
            metrics.incrementFailure(engine, "error");
            return RecognitionResult.failure(e.getMessage());
        } finally {
            metrics.recordLatency(engine, System.nanoTime() - startTime);
            guard.release();
        }
    }
}
