package com.phillippitts.speakstream.server.api;

import com.phillippitts.speakstream.server.connection.SessionRegistry;
import com.phillippitts.speakstream.server.session.SessionSnapshot;
import com.phillippitts.speakstream.server.session.StreamingSession;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of live streaming sessions for operators.
 */
@RestController
@RequestMapping("/api/sessions")
@ConditionalOnWebApplication
class SessionStatusController {

    private final SessionRegistry registry;

    SessionStatusController(SessionRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    ResponseEntity<SessionList> list() {
        List<SessionSnapshot> sessions = registry.snapshots();
        return ResponseEntity.ok(new SessionList(sessions.size(), sessions, Instant.now()));
    }

    @GetMapping("/{id}")
    ResponseEntity<SessionSnapshot> get(@PathVariable String id) {
        return registry.find(id)
                .map(StreamingSession::snapshot)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    record SessionList(int count, List<SessionSnapshot> sessions, Instant timestamp) {}
}
