package com.phillippitts.speakstream.client;

import com.phillippitts.speakstream.domain.RecognitionResult;
import com.phillippitts.speakstream.exception.ConnectionException;
import com.phillippitts.speakstream.exception.ProtocolException;
import com.phillippitts.speakstream.protocol.ProtocolCodec;
import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * WebSocket client for the streaming server built on {@link java.net.http.WebSocket}.
 *
 * <p>Outbound: blocking {@link #sendText(String)} / {@link #sendBinary(byte[])} used by the
 * recording controller's sender thread. Inbound: result messages are decoded on the WebSocket
 * listener, merged into the {@link TranscriptAggregator} and rendered.
 *
 * <p>Server error results are logged and skipped; they never reach the transcript.
 */
public class StreamingAsrClient implements StreamingConnection {

    private static final Logger LOG = LogManager.getLogger(StreamingAsrClient.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

    private final HttpClient httpClient;
    private final TranscriptAggregator aggregator;
    private final TranscriptConsole console;
    private final CompletableFuture<Integer> closed = new CompletableFuture<>();

    private volatile WebSocket webSocket;

    public StreamingAsrClient(HttpClient httpClient, TranscriptAggregator aggregator, TranscriptConsole console) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.console = Objects.requireNonNull(console, "console");
    }

    /**
     * Opens the connection.
     *
     * @throws ConnectionException if the server cannot be reached within {@code timeout}
     */
    public void connect(URI serverUri, Duration timeout) {
        LOG.debug("Connecting to {}", serverUri);
        try {
            this.webSocket = httpClient.newWebSocketBuilder()
                    .connectTimeout(timeout)
                    .buildAsync(serverUri, new ResultListener())
                    .get(timeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            LOG.info("Connected to server: {}", serverUri);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new ConnectionException("Failed to connect to " + serverUri + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new ConnectionException("Timed out connecting to " + serverUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while connecting to " + serverUri, e);
        }
    }

    @Override
    public void sendText(String message) {
        WebSocket ws = openSocket();
        try {
            ws.sendText(message, true).join();
        } catch (CompletionException e) {
            throw new ConnectionException("Failed to send text message: " + rootMessage(e), e);
        }
    }

    @Override
    public void sendBinary(byte[] audio) {
        WebSocket ws = openSocket();
        try {
            ws.sendBinary(ByteBuffer.wrap(audio), true).join();
        } catch (CompletionException e) {
            throw new ConnectionException("Failed to send audio frame: " + rootMessage(e), e);
        }
    }

    @Override
    public boolean isOpen() {
        WebSocket ws = webSocket;
        return ws != null && !ws.isOutputClosed() && !closed.isDone();
    }

    /** Completes with the close status code when the server closes or the connection fails. */
    public CompletableFuture<Integer> closeFuture() {
        return closed;
    }

    @Override
    public void close() {
        WebSocket ws = webSocket;
        if (ws == null) {
            return;
        }
        try {
            if (!ws.isOutputClosed()) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (ExecutionException | TimeoutException e) {
            LOG.debug("Close handshake did not complete: {}", e.toString());
            ws.abort();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ws.abort();
        }
        LOG.info("Disconnected");
    }

    /**
     * Applies one complete result message from the server.
     */
    void handleResult(String payload) {
        RecognitionResult result;
        try {
            result = ProtocolCodec.decodeResult(payload);
        } catch (ProtocolException e) {
            LOG.error("Could not decode server message: {} (payload: {})",
                    e.getMessage(), LogSanitizer.preview(payload));
            return;
        }
        if (result.isFailure()) {
            LOG.error("Server returned error: {}", result.error());
            return;
        }
        boolean appended = aggregator.onResult(result.text());
        LOG.debug("Result: chars={}, segments={}, appended={}", result.text().length(),
                result.segments().size(), appended);
        console.render(aggregator.view());
    }

    private WebSocket openSocket() {
        WebSocket ws = webSocket;
        if (ws == null || ws.isOutputClosed()) {
            throw new ConnectionException("Connection is not open");
        }
        return ws;
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t.getCause() == null ? t : t.getCause();
        return cause.getMessage();
    }

    private final class ResultListener implements WebSocket.Listener {
        private final StringBuilder text = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String payload = text.toString();
                text.setLength(0);
                try {
                    handleResult(payload);
                } catch (RuntimeException e) {
                    LOG.error("Failed to handle server message", e);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            LOG.debug("Ignoring unexpected binary message ({} bytes)", data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            LOG.info("Server connection closed: code={} reason={}", statusCode, reason);
            closed.complete(statusCode);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            LOG.error("Connection error: {}", error.toString());
            closed.complete(-1);
        }
    }
}
