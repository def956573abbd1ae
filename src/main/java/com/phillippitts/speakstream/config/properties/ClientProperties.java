package com.phillippitts.speakstream.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the console recording client.
 *
 * <p>Example:
 * <pre>
 * speakstream.client.server-url=ws://127.0.0.1:8081
 * speakstream.client.sample-rate=16000
 * speakstream.client.send-queue-capacity=256
 * </pre>
 */
@ConfigurationProperties(prefix = "speakstream.client")
@Validated
public class ClientProperties {

    /** WebSocket URL of the recognition server. */
    @NotBlank(message = "Server URL must not be blank")
    private String serverUrl = "ws://127.0.0.1:8081";

    @Positive(message = "Connect timeout must be positive")
    private int connectTimeoutMs = 5_000;

    /** Capture and stream rate announced to the server in the config message. */
    @Positive(message = "Sample rate must be positive")
    private int sampleRate = 16_000;

    /** Frames waiting for the network; further frames are dropped while full. */
    @Min(value = 1, message = "Send queue capacity must be at least 1")
    private int sendQueueCapacity = 256;

    /** Start recording right after connecting. */
    private boolean autoStart = true;

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getSendQueueCapacity() {
        return sendQueueCapacity;
    }

    public void setSendQueueCapacity(int sendQueueCapacity) {
        this.sendQueueCapacity = sendQueueCapacity;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }
}
