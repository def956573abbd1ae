package com.phillippitts.speakstream.config;

import com.phillippitts.speakstream.config.properties.RecognizerProperties;
import com.phillippitts.speakstream.config.stt.VoskConfig;
import com.phillippitts.speakstream.config.stt.WhisperConfig;
import com.phillippitts.speakstream.server.recognition.RecognizerNames;
import com.phillippitts.speakstream.server.recognition.SpeechRecognizer;
import com.phillippitts.speakstream.server.recognition.vosk.VoskSpeechRecognizer;
import com.phillippitts.speakstream.server.recognition.whisper.WhisperSpeechRecognizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Creates the single shared recognizer selected by {@code speakstream.recognizer.engine}.
 *
 * <p>The model is loaded while the context starts, so a missing model aborts startup with a
 * {@link com.phillippitts.speakstream.exception.ModelNotFoundException}. The console client
 * never loads a model.
 */
@Configuration
@Profile("!client")
public class RecognizerConfig {

    private static final Logger LOG = LogManager.getLogger(RecognizerConfig.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "speakstream.recognizer", name = "engine",
            havingValue = RecognizerNames.VOSK, matchIfMissing = true)
    public SpeechRecognizer voskSpeechRecognizer(VoskConfig config, RecognizerProperties properties) {
        return initialized(new VoskSpeechRecognizer(config), properties);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "speakstream.recognizer", name = "engine", havingValue = RecognizerNames.WHISPER)
    public SpeechRecognizer whisperSpeechRecognizer(WhisperConfig config, RecognizerProperties properties) {
        return initialized(new WhisperSpeechRecognizer(config), properties);
    }

    private static SpeechRecognizer initialized(SpeechRecognizer recognizer, RecognizerProperties properties) {
        LOG.info("Loading recognizer engine={} (acquire timeout {} ms)",
                recognizer.getEngineName(), properties.getAcquireTimeoutMs());
        recognizer.initialize();
        return recognizer;
    }
}
