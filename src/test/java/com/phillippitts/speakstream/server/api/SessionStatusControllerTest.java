package com.phillippitts.speakstream.server.api;

import com.phillippitts.speakstream.server.connection.SessionRegistry;
import com.phillippitts.speakstream.server.session.ConnectionState;
import com.phillippitts.speakstream.server.session.SessionSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionStatusControllerTest {

    private final SessionRegistry registry = mock(SessionRegistry.class);
    private final SessionStatusController controller = new SessionStatusController(registry);

    @Test
    void listsLiveSessions() {
        SessionSnapshot snapshot = new SessionSnapshot("s1", ConnectionState.STREAMING, 16_000, 640, 3,
                Instant.parse("2026-01-01T00:00:00Z"));
        when(registry.snapshots()).thenReturn(List.of(snapshot));

        ResponseEntity<SessionStatusController.SessionList> response = controller.list();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().count()).isEqualTo(1);
        assertThat(response.getBody().sessions()).containsExactly(snapshot);
    }

    @Test
    void unknownSessionIsNotFound() {
        when(registry.find("missing")).thenReturn(Optional.empty());

        assertThat(controller.get("missing").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
