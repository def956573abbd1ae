package com.phillippitts.speakstream.server.connection;

import com.phillippitts.speakstream.server.session.SessionSnapshot;
import com.phillippitts.speakstream.server.session.StreamingSession;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Authoritative map of live sessions keyed by connection id.
 *
 * <p>Only {@link ConnectionManager} inserts and removes entries, once each per connection.
 * Thread-safe.
 */
@Component
public class SessionRegistry {

    private final ConcurrentMap<String, StreamingSession> sessions = new ConcurrentHashMap<>();

    /**
     * @return false if a session with the same id is already registered
     */
    boolean register(StreamingSession session) {
        Objects.requireNonNull(session, "session");
        return sessions.putIfAbsent(session.id(), session) == null;
    }

    /**
     * Removes the entry; only the first caller for a given id receives it.
     */
    Optional<StreamingSession> remove(String id) {
        return Optional.ofNullable(sessions.remove(id));
    }

    public Optional<StreamingSession> find(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public boolean contains(String id) {
        return sessions.containsKey(id);
    }

    public int size() {
        return sessions.size();
    }

    /** Snapshots of all live sessions, oldest first. */
    public List<SessionSnapshot> snapshots() {
        return sessions.values().stream()
                .map(StreamingSession::snapshot)
                .sorted(Comparator.comparing(SessionSnapshot::openedAt))
                .toList();
    }
}
