package com.phillippitts.speakstream.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes minimal PCM WAV files (16-bit signed, mono, little-endian) at a caller-chosen rate.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Writes a WAV file containing the given raw PCM16LE mono payload.
     *
     * @param pcm        raw PCM16LE mono audio
     * @param sampleRate sample rate recorded in the header
     * @param wavPath    output file path (will be created or overwritten)
     */
    public static void writePcm16LeMono(byte[] pcm, int sampleRate, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            int dataSize = pcm.length;

            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + dataSize);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);                       // fmt chunk size for PCM
            writeLEShort(os, (short) 1);              // audio format: PCM
            writeLEShort(os, (short) PcmFormat.CHANNELS);
            writeLEInt(os, sampleRate);
            writeLEInt(os, PcmFormat.byteRate(sampleRate));
            writeLEShort(os, (short) PcmFormat.BLOCK_ALIGN);
            writeLEShort(os, (short) PcmFormat.BITS_PER_SAMPLE);

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, dataSize);

            os.write(pcm);
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
