package com.phillippitts.speakstream.server.recognition.whisper;

import com.phillippitts.speakstream.audio.PcmConverter;
import com.phillippitts.speakstream.audio.Resampler;
import com.phillippitts.speakstream.audio.WavWriter;
import com.phillippitts.speakstream.config.stt.WhisperConfig;
import com.phillippitts.speakstream.exception.ModelNotFoundException;
import com.phillippitts.speakstream.server.recognition.AbstractSpeechRecognizer;
import com.phillippitts.speakstream.server.recognition.RecognizerNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link com.phillippitts.speakstream.server.recognition.SpeechRecognizer} backed by the
 * whisper.cpp binary.
 *
 * <p><b>Architecture:</b>
 * <ul>
 *   <li>Resamples to 16 kHz when needed and writes a temporary WAV with {@link WavWriter}</li>
 *   <li>Invokes whisper.cpp via {@link WhisperProcessManager} with the configured timeout</li>
 *   <li>Maps the JSON output with {@link WhisperJsonParser} and deletes the temporary file</li>
 * </ul>
 *
 * <p><b>Privacy:</b> never logs transcript text above DEBUG.
 *
 * @see WhisperProcessManager
 * @see WhisperConfig
 */
public final class WhisperSpeechRecognizer extends AbstractSpeechRecognizer {

    private static final Logger LOG = LogManager.getLogger(WhisperSpeechRecognizer.class);

    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;

    public WhisperSpeechRecognizer(WhisperConfig cfg) {
        this(cfg, new WhisperProcessManager());
    }

    WhisperSpeechRecognizer(WhisperConfig cfg, WhisperProcessManager manager) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    @Override
    protected void doInitialize() {
        Path model = Path.of(cfg.modelPath());
        Path binary = Path.of(cfg.binaryPath());
        if (!Files.isRegularFile(model)) {
            throw new ModelNotFoundException(model.toAbsolutePath().toString());
        }
        if (!Files.isRegularFile(binary)) {
            throw new ModelNotFoundException("whisper binary " + binary.toAbsolutePath());
        }
        if (!Files.isExecutable(binary)) {
            LOG.warn("Whisper binary is not executable: {} (try: chmod +x)", binary);
        }
        LOG.info("Whisper recognizer initialized: bin={}, model={}, timeout={}s, lang={}, threads={}",
                cfg.binaryPath(), cfg.modelPath(), cfg.timeoutSeconds(), cfg.language(), cfg.threads());
    }

    @Override
    public String recognize(float[] samples, int sampleRate) {
        Objects.requireNonNull(samples, "samples");
        if (samples.length == 0) {
            throw new IllegalArgumentException("samples must not be empty");
        }
        ensureInitialized();
        Path wav = null;
        try {
            float[] input = Resampler.linear(samples, sampleRate, WhisperConstants.REQUIRED_SAMPLE_RATE);
            wav = Files.createTempFile("speakstream-", ".wav");
            WavWriter.writePcm16LeMono(PcmConverter.toPcm16(input), WhisperConstants.REQUIRED_SAMPLE_RATE, wav);
            String json = manager.transcribe(wav, cfg);
            return WhisperJsonParser.toRecognizerOutput(json);
        } catch (Exception e) {
            throw wrapFailure(e);
        } finally {
            cleanupTempFile(wav);
        }
    }

    private void cleanupTempFile(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary WAV {}: {}", wav, e.toString());
        }
    }

    @Override
    public String getEngineName() {
        return RecognizerNames.WHISPER;
    }

    @Override
    protected void doClose() {
        manager.close();
        LOG.info("Whisper recognizer closed");
    }
}
