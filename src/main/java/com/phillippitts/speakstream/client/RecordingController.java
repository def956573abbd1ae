package com.phillippitts.speakstream.client;

import com.phillippitts.speakstream.client.capture.AudioCaptureService;
import com.phillippitts.speakstream.client.capture.AudioFrameListener;
import com.phillippitts.speakstream.exception.ConnectionException;
import com.phillippitts.speakstream.protocol.ProtocolCodec;
import com.phillippitts.speakstream.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one recording at a time between the microphone and the streaming connection.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * STOPPED → RECORDING (via start: reset transcript, send config, start capture)
 * RECORDING → STOPPED (via stop: stop capture, send eof)
 * </pre>
 *
 * <p>Outbound messages go through a bounded queue drained by a single sender thread, so the
 * wire order is config, then audio frames in capture order, then eof. The capture thread never
 * blocks on the network: when the queue is full the frame is dropped and counted.
 *
 * <p><b>Thread Safety:</b> start, stop and close are serialized by {@code controlLock}; frame
 * admission is guarded by {@code frameLock} so no frame is queued after eof.
 */
public class RecordingController implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(RecordingController.class);

    public enum State { STOPPED, RECORDING }

    private static final Outbound SHUTDOWN = new Outbound(null, null);

    private final AudioCaptureService capture;
    private final StreamingConnection connection;
    private final TranscriptAggregator aggregator;
    private final TranscriptConsole console;
    private final int sampleRate;
    private final BlockingQueue<Outbound> queue;

    private final Lock controlLock = new ReentrantLock();
    private final Object frameLock = new Object();
    private final AtomicLong droppedFrames = new AtomicLong();
    private final AtomicLong sentFrames = new AtomicLong();
    private final AudioFrameListener frameListener = new FrameListener();

    private volatile State state = State.STOPPED;
    private volatile boolean connectionLost;
    private Thread sender;
    private boolean closed;

    public RecordingController(AudioCaptureService capture,
                               StreamingConnection connection,
                               TranscriptAggregator aggregator,
                               TranscriptConsole console,
                               int sampleRate,
                               int queueCapacity) {
        this.capture = Objects.requireNonNull(capture, "capture");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.console = Objects.requireNonNull(console, "console");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }
        this.sampleRate = sampleRate;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    /** Starts the sender thread. Must be called once before {@link #start()}. */
    public void open() {
        controlLock.lock();
        try {
            if (sender != null) {
                return;
            }
            sender = new Thread(this::drain, "audio-sender");
            sender.setDaemon(true);
            sender.start();
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Begins a recording.
     *
     * @return false if already recording or closed
     */
    public boolean start() {
        controlLock.lock();
        try {
            if (closed || state == State.RECORDING) {
                return false;
            }
            if (sender == null) {
                throw new IllegalStateException("open() must be called before start()");
            }
            aggregator.reset();
            if (!enqueue(new Outbound(ProtocolCodec.encodeConfig(sampleRate), null))) {
                return false;
            }
            synchronized (frameLock) {
                state = State.RECORDING;
            }
            try {
                capture.start(sampleRate, frameListener);
            } catch (RuntimeException e) {
                LOG.error("Failed to start audio capture: {}", e.getMessage());
                synchronized (frameLock) {
                    state = State.STOPPED;
                }
                return false;
            }
            LOG.info("Recording started at {} Hz", sampleRate);
            console.recordingStarted();
            return true;
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Ends the recording and flushes the server side with an eof message.
     *
     * @return false if not recording
     */
    public boolean stop() {
        controlLock.lock();
        try {
            if (state != State.RECORDING) {
                return false;
            }
            synchronized (frameLock) {
                state = State.STOPPED;
            }
            capture.stop();
            enqueue(new Outbound(ProtocolCodec.encodeEof(), null));
            LOG.info("Recording stopped: sentFrames={}, droppedFrames={}", sentFrames.get(), droppedFrames.get());
            console.recordingStopped();
            return true;
        } finally {
            controlLock.unlock();
        }
    }

    /** Starts when stopped, stops when recording. */
    public void toggle() {
        controlLock.lock();
        try {
            if (state == State.RECORDING) {
                stop();
            } else {
                start();
            }
        } finally {
            controlLock.unlock();
        }
    }

    public State state() {
        return state;
    }

    public long droppedFrames() {
        return droppedFrames.get();
    }

    /** True once a send failed; later sends are skipped. */
    public boolean isConnectionLost() {
        return connectionLost;
    }

    /**
     * Stops any recording and waits for queued messages, including the final eof, to be sent.
     */
    @Override
    public void close() {
        Thread toJoin;
        controlLock.lock();
        try {
            if (closed) {
                return;
            }
            stop();
            closed = true;
            toJoin = sender;
            if (toJoin != null) {
                enqueue(SHUTDOWN);
            }
        } finally {
            controlLock.unlock();
        }
        if (toJoin == null) {
            return;
        }
        try {
            toJoin.join(ProcessTimeouts.SENDER_DRAIN_TIMEOUT.toMillis());
            if (toJoin.isAlive()) {
                LOG.warn("Sender did not drain within {}ms; {} messages left",
                        ProcessTimeouts.SENDER_DRAIN_TIMEOUT.toMillis(), queue.size());
                toJoin.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            toJoin.interrupt();
        }
    }

    private boolean enqueue(Outbound message) {
        try {
            queue.put(message);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while queueing outbound message");
            return false;
        }
    }

    private void drain() {
        while (true) {
            Outbound message;
            try {
                message = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (message == SHUTDOWN) {
                return;
            }
            if (connectionLost) {
                continue;
            }
            try {
                if (message.audio() != null) {
                    connection.sendBinary(message.audio());
                    sentFrames.incrementAndGet();
                } else {
                    connection.sendText(message.text());
                }
            } catch (ConnectionException e) {
                connectionLost = true;
                LOG.error("Connection lost, discarding outbound audio: {}", e.getMessage());
                console.notice("Connection to server lost");
            }
        }
    }

    private final class FrameListener implements AudioFrameListener {
        @Override
        public void onFrame(byte[] frame) {
            synchronized (frameLock) {
                if (state != State.RECORDING) {
                    return;
                }
                if (!queue.offer(new Outbound(null, frame))) {
                    long dropped = droppedFrames.incrementAndGet();
                    if (dropped == 1 || dropped % 50 == 0) {
                        LOG.warn("Send queue full, dropped {} frame(s) so far", dropped);
                    }
                }
            }
        }

        @Override
        public void onCaptureError(String reason) {
            LOG.error("Audio capture failed: {}", reason);
            console.notice("Audio capture failed: " + reason);
        }
    }

    private record Outbound(String text, byte[] audio) {}
}
