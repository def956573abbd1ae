package com.phillippitts.speakstream.audio;

import java.util.Objects;

/**
 * Conversions between PCM16LE bytes and normalized float samples.
 *
 * <p>Both directions are pure and total: every byte array of even length maps to a sample
 * array and back. A trailing odd byte is ignored.
 */
public final class PcmConverter {

    private PcmConverter() {}

    /**
     * Converts little-endian signed 16-bit samples to floats in [-1.0, 1.0) by dividing by 32768.
     *
     * @param pcm raw PCM16LE bytes
     * @return one float per complete sample
     */
    public static float[] toFloatSamples(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        int count = pcm.length / PcmFormat.BLOCK_ALIGN;
        float[] samples = new float[count];
        for (int i = 0; i < count; i++) {
            int lo = pcm[2 * i] & 0xFF;
            int hi = pcm[2 * i + 1]; // sign-extended
            short sample = (short) ((hi << 8) | lo);
            samples[i] = sample / PcmFormat.INT16_SCALE;
        }
        return samples;
    }

    /**
     * Converts normalized float samples back to PCM16LE, clamping values outside [-1.0, 1.0].
     *
     * @param samples normalized samples
     * @return PCM16LE bytes, two per sample
     */
    public static byte[] toPcm16(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        byte[] out = new byte[samples.length * PcmFormat.BLOCK_ALIGN];
        for (int i = 0; i < samples.length; i++) {
            float clamped = Math.max(-1.0f, Math.min(1.0f, samples[i]));
            int value = Math.round(clamped * PcmFormat.INT16_SCALE);
            value = Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, value));
            out[2 * i] = (byte) (value & 0xFF);
            out[2 * i + 1] = (byte) ((value >>> 8) & 0xFF);
        }
        return out;
    }
}
