package com.phillippitts.speakstream.server.ws;

import com.phillippitts.speakstream.exception.ConnectionException;
import com.phillippitts.speakstream.server.session.ResultSink;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link ResultSink} writing text frames to a WebSocket session.
 *
 * <p>Expects a {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
 * so writes from the session worker never interleave with other writers.
 */
final class WebSocketResultSink implements ResultSink {

    private final WebSocketSession session;

    WebSocketResultSink(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public void sendText(String payload) {
        if (!session.isOpen()) {
            throw new ConnectionException("WebSocket " + session.getId() + " is closed");
        }
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (IOException | IllegalStateException e) {
            throw new ConnectionException("Failed to send result on " + session.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
