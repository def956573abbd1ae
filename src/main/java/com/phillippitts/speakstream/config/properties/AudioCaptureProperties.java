package com.phillippitts.speakstream.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture on the client.
 *
 * Format is fixed by the service: 16-bit PCM, mono, little-endian at the client sample rate.
 */
@Validated
@ConfigurationProperties(prefix = "speakstream.capture")
public class AudioCaptureProperties {

    /** Size of one frame read from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(1000)
    private final int chunkMillis;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(@DefaultValue("100") int chunkMillis, String deviceName) {
        this.chunkMillis = chunkMillis;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getChunkMillis() { return chunkMillis; }
    public String getDeviceName() { return deviceName; }
}
