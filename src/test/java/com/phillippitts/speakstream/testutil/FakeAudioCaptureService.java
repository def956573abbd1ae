package com.phillippitts.speakstream.testutil;

import com.phillippitts.speakstream.client.capture.AudioCaptureService;
import com.phillippitts.speakstream.client.capture.AudioFrameListener;

/**
 * Capture service driven by the test: frames are pushed with {@link #emit(byte[])}.
 */
public class FakeAudioCaptureService implements AudioCaptureService {

    private volatile AudioFrameListener listener;
    private volatile int sampleRate;
    private volatile int starts;
    private volatile boolean failOnStart;

    @Override
    public synchronized void start(int sampleRate, AudioFrameListener listener) {
        if (failOnStart) {
            throw new IllegalStateException("no microphone");
        }
        if (this.listener != null) {
            throw new IllegalStateException("Another capture is already active");
        }
        this.sampleRate = sampleRate;
        this.listener = listener;
        starts++;
    }

    @Override
    public synchronized void stop() {
        listener = null;
    }

    @Override
    public boolean isCapturing() {
        return listener != null;
    }

    /** Delivers a frame as the capture thread would; ignored when not capturing. */
    public void emit(byte[] frame) {
        AudioFrameListener l = listener;
        if (l != null) {
            l.onFrame(frame);
        }
    }

    /** Delivers to a listener even after stop, like a capture thread racing the stop call. */
    public void emitTo(AudioFrameListener target, byte[] frame) {
        target.onFrame(frame);
    }

    public AudioFrameListener currentListener() {
        return listener;
    }

    public void failOnStart() {
        this.failOnStart = true;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int starts() {
        return starts;
    }
}
