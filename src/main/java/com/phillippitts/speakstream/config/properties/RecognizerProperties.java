package com.phillippitts.speakstream.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Selection of the recognizer engine and access to it.
 *
 * <p>The recognizer is one shared instance, so calls from all sessions are serialized. A
 * dispatch that cannot obtain the recognizer within {@code acquire-timeout-ms} fails with an
 * error result instead of waiting forever.
 *
 * <p>Properties:
 * <ul>
 *   <li>speakstream.recognizer.engine - {@code vosk} or {@code whisper} (default: vosk)</li>
 *   <li>speakstream.recognizer.acquire-timeout-ms - wait for the shared recognizer (default: 60000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "speakstream.recognizer")
@Validated
public class RecognizerProperties {

    @NotBlank(message = "Recognizer engine must not be blank")
    private String engine = "vosk";

    @Positive(message = "Acquire timeout must be positive")
    private long acquireTimeoutMs = 60_000;

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
