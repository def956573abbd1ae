package com.phillippitts.speakstream.audio;

/**
 * Single source of truth for the streamed audio format.
 * Streamed audio is 16-bit signed PCM, mono, little-endian; the sample rate is per session.
 */
public final class PcmFormat {

    /** Sample rate assumed until a session sends a config message. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    /** Bits per sample. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes

    /** Divisor mapping a signed 16-bit sample onto [-1.0, 1.0]. */
    public static final float INT16_SCALE = 32768.0f;

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BYTE_RATE_OFFSET = 28;           // 4 bytes (LE)
    public static final int WAV_BLOCK_ALIGN_OFFSET = 32;         // 2 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)

    private PcmFormat() {}

    /** Bytes per second of mono 16-bit audio at the given rate. */
    public static int byteRate(int sampleRate) {
        return sampleRate * BLOCK_ALIGN;
    }

    /** Java Sound descriptor for PCM16LE mono at the given rate. */
    public static javax.sound.sampled.AudioFormat javaSoundFormat(int sampleRate) {
        return new javax.sound.sampled.AudioFormat(sampleRate, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }
}
