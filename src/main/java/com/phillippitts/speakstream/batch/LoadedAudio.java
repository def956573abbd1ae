package com.phillippitts.speakstream.batch;

/**
 * Decoded audio file: mono samples normalized to [-1, 1].
 *
 * @param samples          mono float samples
 * @param sampleRate       native rate of the file
 * @param originalChannels channel count before mixdown
 */
public record LoadedAudio(float[] samples, int sampleRate, int originalChannels) {

    public double durationSeconds() {
        return sampleRate == 0 ? 0.0 : (double) samples.length / sampleRate;
    }
}
