package com.phillippitts.speakstream.client.capture;

import com.phillippitts.speakstream.audio.PcmFormat;
import com.phillippitts.speakstream.config.properties.AudioCaptureProperties;
import com.phillippitts.speakstream.util.ProcessTimeouts;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based microphone capture producing PCM16LE mono frames of
 * {@code speakstream.capture.chunk-millis} each.
 *
 * <p>Thread-safe for a single active capture.
 */
@Service
@Profile("client")
public class JavaSoundAudioCaptureService implements AudioCaptureService {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioCaptureService.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private Capture current;

    @org.springframework.beans.factory.annotation.Autowired
    public JavaSoundAudioCaptureService(AudioCaptureProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioCaptureService(AudioCaptureProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Capture device '{}' not found; using system default", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public void start(int sampleRate, AudioFrameListener listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new IllegalStateException("Another capture is already active");
            }
            int bytesPerChunk = Math.max(PcmFormat.BLOCK_ALIGN,
                    (int) ((long) props.getChunkMillis() * PcmFormat.byteRate(sampleRate) / 1000));
            bytesPerChunk -= bytesPerChunk % PcmFormat.BLOCK_ALIGN;
            Capture capture = new Capture();
            capture.active.set(true);
            final int chunk = bytesPerChunk;
            Thread t = new Thread(() -> doCapture(capture, PcmFormat.javaSoundFormat(sampleRate), chunk, listener),
                    "audio-capture");
            t.setDaemon(true);
            capture.thread = t;
            current = capture;
            LOG.info("Starting capture: rate={} Hz, frame={} bytes, device='{}'", sampleRate, chunk,
                    props.getDeviceName() != null ? props.getDeviceName() : "default");
            t.start();
        }
    }

    @Override
    public void stop() {
        Thread captureThread;
        synchronized (lock) {
            if (current == null) {
                return;
            }
            current.active.set(false);
            captureThread = current.thread;
            current = null;
        }
        // Join outside the lock; the capture thread never takes it
        joinThread(captureThread, ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
    }

    @Override
    public boolean isCapturing() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    private void doCapture(Capture capture, javax.sound.sampled.AudioFormat fmt, int bytesPerChunk,
                           AudioFrameListener listener) {
        TargetDataLine line = null;
        long written = 0;
        try {
            line = provider.open(fmt, Optional.ofNullable(props.getDeviceName()));
            line.start();
            byte[] buf = new byte[bytesPerChunk];
            while (capture.active.get()) {
                int n = line.read(buf, 0, buf.length);
                if (n <= 0 || !capture.active.get()) {
                    continue;
                }
                listener.onFrame(Arrays.copyOf(buf, n));
                written += n;
            }
            LOG.info("Audio capture completed: {} bytes captured", written);
        } catch (LineUnavailableException e) {
            LOG.warn("Microphone unavailable: {}", e.getMessage());
            listener.onCaptureError("MIC_UNAVAILABLE");
        } catch (SecurityException se) {
            LOG.warn("Microphone access denied: {}", se.getMessage());
            listener.onCaptureError("MIC_PERMISSION_DENIED");
        } catch (RuntimeException e) {
            LOG.warn("Capture failed: {}", e.toString());
            listener.onCaptureError("CAPTURE_ERROR");
        } finally {
            capture.active.set(false);
            closeLine(line);
        }
    }

    private static void closeLine(TargetDataLine line) {
        if (line == null) {
            return;
        }
        try {
            line.stop();
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing capture line: {}", e.toString());
        }
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static final class Capture {
        final AtomicBoolean active = new AtomicBoolean(false);
        volatile Thread thread;
    }
}
