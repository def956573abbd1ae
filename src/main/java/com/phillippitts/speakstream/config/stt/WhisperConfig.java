package com.phillippitts.speakstream.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the whisper.cpp recognizer.
 * Binds to properties prefixed with "speakstream.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * speakstream.whisper.binary-path=tools/whisper.cpp/main
 * speakstream.whisper.model-path=models/ggml-base.bin
 * speakstream.whisper.timeout-seconds=30
 * speakstream.whisper.language=auto
 * speakstream.whisper.threads=4
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp binary executable
 * @param modelPath Path to the GGML model file (.bin)
 * @param timeoutSeconds Maximum time to wait for one recognition (in seconds)
 * @param language Language code for recognition (e.g., "en", "zh", "auto")
 * @param threads Number of CPU threads to use
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "speakstream.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper binary path must not be blank")
        @DefaultValue("tools/whisper.cpp/main")
        String binaryPath,

        @NotBlank(message = "Whisper model path must not be blank")
        @DefaultValue("models/ggml-base.bin")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("30")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        @DefaultValue("auto")
        String language,

        @Positive(message = "Thread count must be positive")
        @DefaultValue("4")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("1048576")
        int maxStdoutBytes
) {
}
