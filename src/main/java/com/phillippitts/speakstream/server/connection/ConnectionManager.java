package com.phillippitts.speakstream.server.connection;

import com.phillippitts.speakstream.config.properties.SessionProperties;
import com.phillippitts.speakstream.domain.RecognitionResult;
import com.phillippitts.speakstream.exception.ConnectionException;
import com.phillippitts.speakstream.exception.ProtocolException;
import com.phillippitts.speakstream.protocol.ControlMessage;
import com.phillippitts.speakstream.protocol.ControlMessage.ConfigMessage;
import com.phillippitts.speakstream.protocol.ControlMessage.EofMessage;
import com.phillippitts.speakstream.protocol.ProtocolCodec;
import com.phillippitts.speakstream.server.recognition.RecognitionDispatcher;
import com.phillippitts.speakstream.server.session.AudioChunk;
import com.phillippitts.speakstream.server.session.ResultSink;
import com.phillippitts.speakstream.server.session.SessionBuffer;
import com.phillippitts.speakstream.server.session.StreamingSession;
import com.phillippitts.speakstream.util.LogSanitizer;
import com.phillippitts.speakstream.util.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Routes transport events to sessions and owns their lifecycle.
 *
 * <p>Per connection:
 * <ul>
 *   <li>open: create and register a session with an empty buffer at the default rate</li>
 *   <li>text: decode a control message; config updates the rate, eof flushes and replies,
 *       unknown types are ignored, malformed messages are logged and skipped</li>
 *   <li>binary: append to the buffer, dispatching and replying when the threshold is reached</li>
 *   <li>close or error: unregister, discard buffered audio, release the session</li>
 * </ul>
 *
 * <p>Messages for one session are processed strictly in arrival order on that session's serial
 * executor; sessions run in parallel on the shared {@code sessionExecutor}. Recognition runs on
 * the dispatcher's single worker and the result is sent from a new task on the session's
 * executor, so a busy recognizer never holds a session pool thread. Each dispatch sends exactly
 * one result, in dispatch order.
 */
@Component
@ConditionalOnWebApplication
public class ConnectionManager {

    private static final Logger LOG = LogManager.getLogger(ConnectionManager.class);

    private final SessionRegistry registry;
    private final RecognitionDispatcher dispatcher;
    private final SessionProperties properties;
    private final Executor sessionExecutor;

    public ConnectionManager(SessionRegistry registry,
                             RecognitionDispatcher dispatcher,
                             SessionProperties properties,
                             @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
    }

    /**
     * Creates the session for a new connection.
     *
     * @throws IllegalStateException if a session with this id already exists
     */
    public StreamingSession onOpen(String sessionId, ResultSink sink) {
        SessionBuffer buffer = new SessionBuffer(sessionId,
                properties.getDispatchThresholdBytes(), properties.getDefaultSampleRate());
        StreamingSession session = new StreamingSession(sessionId, buffer,
                new SerialExecutor(sessionExecutor, "session-" + sessionId), sink);
        if (!registry.register(session)) {
            throw new IllegalStateException("Duplicate session id: " + sessionId);
        }
        LOG.info("Session {} opened ({} live)", sessionId, registry.size());
        return session;
    }

    public void onText(String sessionId, String payload) {
        withSession(sessionId, "text", session -> session.submit(() -> handleControl(session, payload)));
    }

    public void onBinary(String sessionId, byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        withSession(sessionId, "binary", session -> session.submit(() -> {
            LOG.trace("Received {} audio bytes", frame.length);
            session.append(frame).ifPresent(chunk -> dispatchAndReply(session, chunk));
        }));
    }

    /**
     * Terminal cleanup for any termination path. Safe to call more than once.
     */
    public void onClose(String sessionId, String reason) {
        registry.remove(sessionId).ifPresent(session -> {
            session.close();
            LOG.info("Session {} closed: {} ({} live)", sessionId, reason, registry.size());
        });
    }

    public void onError(String sessionId, Throwable error) {
        LOG.warn("Session {} transport error: {}", sessionId, error.toString());
        onClose(sessionId, "error");
    }

    private void handleControl(StreamingSession session, String payload) {
        ControlMessage message;
        try {
            message = ProtocolCodec.decodeControl(payload);
        } catch (ProtocolException e) {
            LOG.warn("Skipping malformed control message: {} (payload: {})",
                    e.getMessage(), LogSanitizer.preview(e.getPayload()));
            return;
        }
        if (message instanceof ConfigMessage config) {
            session.configure(config.sampleRate());
            LOG.info("Session {} configured: sample_rate={}", session.id(), config.sampleRate());
        } else if (message instanceof EofMessage) {
            AudioChunk chunk = session.flush();
            LOG.debug("Session {} eof with {} buffered bytes", session.id(), chunk.size());
            dispatchAndReply(session, chunk);
        } else {
            LOG.info("Ignoring control message of unknown type '{}'", LogSanitizer.preview(message.type()));
        }
    }

    private void dispatchAndReply(StreamingSession session, AudioChunk chunk) {
        dispatcher.dispatchAsync(chunk, result -> {
            if (!session.submit(() -> reply(session, result))) {
                LOG.debug("Session {} closed during dispatch; dropping result", session.id());
            }
        });
    }

    private void reply(StreamingSession session, RecognitionResult result) {
        session.recordDispatch();
        try {
            session.sink().sendText(ProtocolCodec.encodeResult(result));
        } catch (ConnectionException e) {
            LOG.warn("Session {} could not receive result: {}", session.id(), e.getMessage());
            onClose(session.id(), "send failure");
        }
    }

    private void withSession(String sessionId, String kind, Consumer<StreamingSession> action) {
        registry.find(sessionId).ifPresentOrElse(action,
                () -> LOG.debug("Dropping {} message for unknown or closed session {}", kind, sessionId));
    }

    public int activeSessions() {
        return registry.size();
    }
}
