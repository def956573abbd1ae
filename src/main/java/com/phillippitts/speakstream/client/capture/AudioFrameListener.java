package com.phillippitts.speakstream.client.capture;

/**
 * Receives captured audio on the capture thread.
 *
 * <p>Implementations must return quickly and never block on I/O: the capture thread is the only
 * reader of the device and a slow callback drops audio at the driver.
 */
public interface AudioFrameListener {

    /**
     * @param frame PCM16LE mono bytes; a fresh array owned by the listener
     */
    void onFrame(byte[] frame);

    /**
     * Capture ended abnormally (device unavailable, permission denied, I/O error).
     *
     * @param reason short machine-readable reason, e.g. {@code MIC_UNAVAILABLE}
     */
    default void onCaptureError(String reason) {
    }
}
