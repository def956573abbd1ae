package com.phillippitts.speakstream.server.ws;

import com.phillippitts.speakstream.server.connection.ConnectionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapts WebSocket callbacks to {@link ConnectionManager} events.
 *
 * <p>Text frames are control messages, binary frames are PCM16LE audio. The WebSocket session
 * id is the session id.
 *
 * <p>Partial messages are enabled so binary frames of any size are accepted: each piece the
 * container delivers is appended as it arrives, which is equivalent since audio frames are
 * concatenated anyway. Text pieces are joined until the last one; a control message longer
 * than {@link #MAX_CONTROL_MESSAGE_CHARS} is dropped and logged.
 */
@Component
@ConditionalOnWebApplication
public class StreamingWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(StreamingWebSocketHandler.class);

    /** Limits for the concurrent send decorator. */
    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    static final int MAX_CONTROL_MESSAGE_CHARS = 64 * 1024;

    private final ConnectionManager connectionManager;
    private final Map<String, PendingText> partialText = new ConcurrentHashMap<>();

    public StreamingWebSocketHandler(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        LOG.info("New connection: sessionId={} remote={}", session.getId(), session.getRemoteAddress());
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        connectionManager.onOpen(session.getId(), new WebSocketResultSink(concurrent));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String id = session.getId();
        PendingText pending = partialText.get(id);
        if (message.isLast() && pending == null) {
            connectionManager.onText(id, message.getPayload());
            return;
        }
        if (pending == null) {
            pending = new PendingText();
            partialText.put(id, pending);
        }
        pending.append(message.getPayload());
        if (message.isLast()) {
            partialText.remove(id);
            if (pending.overflow) {
                LOG.error("Session {} control message exceeds {} chars; dropping it", id, MAX_CONTROL_MESSAGE_CHARS);
            } else {
                connectionManager.onText(id, pending.text.toString());
            }
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ByteBuffer payload = message.getPayload();
        byte[] frame = new byte[payload.remaining()];
        payload.get(frame);
        connectionManager.onBinary(session.getId(), frame);
    }

    @Override
    public boolean supportsPartialMessages() {
        return true;
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        partialText.remove(session.getId());
        connectionManager.onError(session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        partialText.remove(session.getId());
        connectionManager.onClose(session.getId(), "code=" + status.getCode()
                + (status.getReason() == null ? "" : " reason=" + status.getReason()));
    }

    private static final class PendingText {
        private final StringBuilder text = new StringBuilder();
        private boolean overflow;

        void append(String piece) {
            if (overflow) {
                return;
            }
            if (text.length() + piece.length() > MAX_CONTROL_MESSAGE_CHARS) {
                overflow = true;
                text.setLength(0);
                return;
            }
            text.append(piece);
        }
    }
}
