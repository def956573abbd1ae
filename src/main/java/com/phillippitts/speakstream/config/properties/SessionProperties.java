package com.phillippitts.speakstream.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Server-side session settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>speakstream.session.dispatch-threshold-bytes - buffered bytes that trigger a dispatch (default: 32000)</li>
 *   <li>speakstream.session.default-sample-rate - rate assumed before a config message (default: 16000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "speakstream.session")
@Validated
public class SessionProperties {

    /** Buffered byte count at which accumulated audio is submitted for recognition. */
    @Min(value = 2, message = "Dispatch threshold must be at least one sample (2 bytes)")
    private int dispatchThresholdBytes = 32_000;

    /** Sample rate used until the client sends a config message. */
    @Positive(message = "Default sample rate must be positive")
    private int defaultSampleRate = 16_000;

    public int getDispatchThresholdBytes() {
        return dispatchThresholdBytes;
    }

    public void setDispatchThresholdBytes(int dispatchThresholdBytes) {
        this.dispatchThresholdBytes = dispatchThresholdBytes;
    }

    public int getDefaultSampleRate() {
        return defaultSampleRate;
    }

    public void setDefaultSampleRate(int defaultSampleRate) {
        this.defaultSampleRate = defaultSampleRate;
    }
}
