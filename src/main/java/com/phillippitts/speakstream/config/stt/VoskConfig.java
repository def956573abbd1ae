package com.phillippitts.speakstream.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Configuration properties for the Vosk recognizer.
 * Binds to properties prefixed with "speakstream.vosk".
 *
 * <p>Example application.properties:
 * <pre>
 * speakstream.vosk.model-path=models/vosk-model-small-en-us-0.15
 * speakstream.vosk.word-timestamps=true
 * </pre>
 *
 * @param modelPath      Path to the Vosk model directory (must exist)
 * @param wordTimestamps Request per-word start/end times from the recognizer
 */
@ConfigurationProperties(prefix = "speakstream.vosk")
@Validated
public record VoskConfig(
        @NotBlank(message = "Vosk model path must not be blank")
        @DefaultValue("models/vosk-model-small-en-us-0.15")
        String modelPath,

        @DefaultValue("true")
        boolean wordTimestamps
) {
}
