package com.phillippitts.speakstream.client.capture;

/**
 * Microphone capture streaming fixed-size frames to a listener.
 *
 * Contract:
 * - One active capture at a time
 * - Frames are raw PCM16LE mono at the requested sample rate
 * - After {@link #stop()} returns no further frames are delivered
 */
public interface AudioCaptureService {

    /**
     * Starts capturing on a dedicated thread.
     *
     * @throws IllegalStateException if a capture is already active
     */
    void start(int sampleRate, AudioFrameListener listener);

    /** Stops capture and waits for the capture thread to finish. No-op if not capturing. */
    void stop();

    boolean isCapturing();
}
