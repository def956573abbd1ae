package com.phillippitts.speakstream.server.session;

import java.time.Instant;

/**
 * Point-in-time view of a session for status reporting.
 *
 * @param id            session identifier
 * @param state         connection state
 * @param sampleRate    sample rate applied to subsequent audio
 * @param bufferedBytes bytes waiting for the next dispatch
 * @param dispatches    completed dispatches
 * @param openedAt      connection time
 */
public record SessionSnapshot(String id,
                              ConnectionState state,
                              int sampleRate,
                              int bufferedBytes,
                              long dispatches,
                              Instant openedAt) {
}
