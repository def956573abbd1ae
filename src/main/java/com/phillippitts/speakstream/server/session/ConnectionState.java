package com.phillippitts.speakstream.server.session;

/**
 * Lifecycle of one streaming connection.
 *
 * <p>{@code OPEN -> CONFIGURED -> STREAMING -> CLOSED}. CONFIGURED and STREAMING may occur in
 * either order: audio may arrive before any config message and is then read at the default
 * rate. CLOSED is terminal.
 */
public enum ConnectionState {
    /** Connected, nothing received yet. */
    OPEN,
    /** Latest message was a config message. */
    CONFIGURED,
    /** At least one audio frame received since the last config message. */
    STREAMING,
    /** Connection closed or failed; no further messages are processed. */
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
