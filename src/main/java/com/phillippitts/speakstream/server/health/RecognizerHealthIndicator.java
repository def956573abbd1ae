package com.phillippitts.speakstream.server.health;

import com.phillippitts.speakstream.server.connection.SessionRegistry;
import com.phillippitts.speakstream.server.recognition.SpeechRecognizer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;

/**
 * Reports whether the shared recognizer is loaded.
 *
 * <ul>
 *   <li>UP: recognizer initialized and not closed</li>
 *   <li>DOWN: recognizer closed or failed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code recognizer}.
 */
@Component("recognizer")
@ConditionalOnWebApplication
public class RecognizerHealthIndicator implements HealthIndicator {

    private final SpeechRecognizer recognizer;
    private final SessionRegistry registry;

    public RecognizerHealthIndicator(SpeechRecognizer recognizer, SessionRegistry registry) {
        this.recognizer = recognizer;
        this.registry = registry;
    }

    @Override
    public Health health() {
        Health.Builder builder = recognizer.isHealthy() ? Health.up() : Health.down();
        return builder
                .withDetail("engine", recognizer.getEngineName())
                .withDetail("status", recognizer.isHealthy() ? "ready" : "unavailable")
                .withDetail("liveSessions", registry.size())
                .build();
    }
}
