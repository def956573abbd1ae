package com.phillippitts.speakstream.server.recognition;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for recognizer dispatches.
 *
 * <p>Exposes latency per engine, success/failure counts and the number of audio bytes submitted.
 */
@Component
public class RecognitionMetrics {

    private static final String METRIC_PREFIX = "speakstream.recognition";

    private final MeterRegistry registry;

    public RecognitionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by one recognizer call")
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String engineName) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful dispatches")
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * @param reason short failure category (error, busy, shape)
     */
    public void incrementFailure(String engineName, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed dispatches")
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAudioBytes(String engineName, int bytes) {
        Counter.builder(METRIC_PREFIX + ".audio.bytes")
                .description("PCM bytes submitted for recognition")
                .baseUnit("bytes")
                .tag("engine", engineName)
                .register(registry)
                .increment(bytes);
    }
}
