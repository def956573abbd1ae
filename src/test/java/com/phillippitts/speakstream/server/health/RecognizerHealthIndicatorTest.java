package com.phillippitts.speakstream.server.health;

import com.phillippitts.speakstream.server.connection.SessionRegistry;
import com.phillippitts.speakstream.testutil.FakeSpeechRecognizer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class RecognizerHealthIndicatorTest {

    @Test
    void upWhileRecognizerIsLoaded() {
        FakeSpeechRecognizer recognizer = new FakeSpeechRecognizer();

        Health health = new RecognizerHealthIndicator(recognizer, new SessionRegistry()).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("engine", "fake")
                .containsEntry("status", "ready")
                .containsEntry("liveSessions", 0);
    }

    @Test
    void downOnceRecognizerIsClosed() {
        FakeSpeechRecognizer recognizer = new FakeSpeechRecognizer();
        recognizer.close();

        Health health = new RecognizerHealthIndicator(recognizer, new SessionRegistry()).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "unavailable");
    }
}
