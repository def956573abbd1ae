package com.phillippitts.speakstream.audio;

import java.util.Objects;

/**
 * Linear-interpolation sample rate conversion for mono float audio.
 *
 * <p>Good enough for speech fed to a recognizer that only accepts a fixed rate; not intended
 * for playback quality.
 */
public final class Resampler {

    private Resampler() {}

    /**
     * @return {@code samples} itself when the rates match, otherwise a new array at {@code toRate}
     */
    public static float[] linear(float[] samples, int fromRate, int toRate) {
        Objects.requireNonNull(samples, "samples must not be null");
        if (fromRate <= 0 || toRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: " + fromRate + " -> " + toRate);
        }
        if (fromRate == toRate || samples.length == 0) {
            return samples;
        }
        int outLength = (int) Math.max(1, Math.round((double) samples.length * toRate / fromRate));
        float[] out = new float[outLength];
        double step = (double) fromRate / toRate;
        for (int i = 0; i < outLength; i++) {
            double pos = i * step;
            int idx = (int) pos;
            if (idx >= samples.length - 1) {
                out[i] = samples[samples.length - 1];
                continue;
            }
            double frac = pos - idx;
            out[i] = (float) (samples[idx] + (samples[idx + 1] - samples[idx]) * frac);
        }
        return out;
    }
}
