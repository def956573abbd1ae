package com.phillippitts.speakstream.server.recognition.vosk;

import com.phillippitts.speakstream.audio.PcmConverter;
import com.phillippitts.speakstream.config.stt.VoskConfig;
import com.phillippitts.speakstream.exception.ModelNotFoundException;
import com.phillippitts.speakstream.server.recognition.AbstractSpeechRecognizer;
import com.phillippitts.speakstream.server.recognition.RecognizerNames;
import com.phillippitts.speakstream.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Vosk-based {@link com.phillippitts.speakstream.server.recognition.SpeechRecognizer}.
 *
 * <p>The model is loaded once in {@link #initialize()}; a native recognizer is created per call
 * at the caller's sample rate, so each dispatch is decoded independently of the previous one.
 *
 * <p>Thread-safe: the model is only read after initialization and recognizers are per call.
 */
public class VoskSpeechRecognizer extends AbstractSpeechRecognizer {

    private static final Logger LOG = LogManager.getLogger(VoskSpeechRecognizer.class);

    private final VoskConfig config;

    // @GuardedBy("lock")
    private org.vosk.Model model;

    public VoskSpeechRecognizer(VoskConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    protected void doInitialize() {
        Path modelDir = Path.of(config.modelPath());
        if (!Files.isDirectory(modelDir)) {
            throw new ModelNotFoundException(modelDir.toAbsolutePath().toString());
        }
        LOG.info("Initializing Vosk recognizer: modelPath={}, wordTimestamps={}",
                config.modelPath(), config.wordTimestamps());
        try {
            this.model = new org.vosk.Model(modelDir.toString());
            LOG.info("Vosk recognizer initialized");
        } catch (Throwable t) { // include UnsatisfiedLinkError from the JNI layer
            safeCloseUnlocked();
            throw new ModelNotFoundException(config.modelPath(), t);
        }
    }

    @Override
    public String recognize(float[] samples, int sampleRate) {
        Objects.requireNonNull(samples, "samples");
        if (samples.length == 0) {
            throw new IllegalArgumentException("samples must not be empty");
        }
        org.vosk.Model localModel = modelForRecognition();
        long startTime = System.nanoTime();
        byte[] pcm = PcmConverter.toPcm16(samples);
        try (org.vosk.Recognizer recognizer = new org.vosk.Recognizer(localModel, sampleRate)) {
            recognizer.setWords(config.wordTimestamps());
            recognizer.acceptWaveForm(pcm, pcm.length);
            String json = recognizer.getFinalResult();
            LOG.debug("Vosk decoded {} samples @ {} Hz in {} ms (json length={})",
                    samples.length, sampleRate, TimeUtils.elapsedMillis(startTime), json == null ? 0 : json.length());
            return VoskResultMapper.toRecognizerOutput(json);
        } catch (Exception e) {
            throw wrapFailure(e);
        }
    }

    private org.vosk.Model modelForRecognition() {
        ensureInitialized();
        synchronized (lock) {
            return this.model;
        }
    }

    @Override
    public String getEngineName() {
        return RecognizerNames.VOSK;
    }

    @Override
    protected void doClose() {
        safeCloseUnlocked();
        LOG.info("Vosk recognizer closed");
    }

    // GuardedBy: lock (caller must hold lock)
    private void safeCloseUnlocked() {
        if (model != null) {
            try {
                model.close();
            } catch (Throwable t) {
                LOG.warn("Error closing Vosk model", t);
            }
            model = null;
        }
    }
}
