package com.phillippitts.speakstream.batch;

import com.phillippitts.speakstream.exception.InvalidAudioException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;

/**
 * Loads WAV, AIFF and AU files through Java Sound and normalizes them to mono floats.
 *
 * <p>Supported encodings: signed PCM 16/24/32 bit, unsigned PCM 8 bit, IEEE float 32 bit.
 * Multi-channel audio is mixed down by averaging the channels of each frame.
 */
public class AudioFileLoader {

    private static final Logger LOG = LogManager.getLogger(AudioFileLoader.class);

    /**
     * @throws InvalidAudioException if the file cannot be read or uses an unsupported encoding
     */
    public LoadedAudio load(Path file) {
        String source = file.toString();
        try (AudioInputStream in = AudioSystem.getAudioInputStream(file.toFile())) {
            AudioFormat format = in.getFormat();
            LOG.debug("Audio format of {}: {}", file.getFileName(), format);
            byte[] data = in.readAllBytes();
            float[] mono = decode(data, format, source);
            LoadedAudio audio = new LoadedAudio(mono, Math.round(format.getSampleRate()), format.getChannels());
            LOG.info("Loaded {}: {} Hz, {} channel(s), {}s", file.getFileName(), audio.sampleRate(),
                    audio.originalChannels(), String.format("%.2f", audio.durationSeconds()));
            return audio;
        } catch (UnsupportedAudioFileException e) {
            throw new InvalidAudioException(source, "unsupported file format", e);
        } catch (IOException e) {
            throw new InvalidAudioException(source, "read failed: " + e.getMessage(), e);
        }
    }

    static float[] decode(byte[] data, AudioFormat format, String source) {
        int channels = format.getChannels();
        int bits = format.getSampleSizeInBits();
        if (channels < 1 || bits <= 0 || bits % 8 != 0) {
            throw new InvalidAudioException(source, "unsupported layout: " + format);
        }
        int bytesPerSample = bits / 8;
        int frameSize = bytesPerSample * channels;
        int frames = data.length / frameSize;
        ByteBuffer buf = ByteBuffer.wrap(data)
                .order(format.isBigEndian() ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);
        SampleReader reader = readerFor(format.getEncoding(), bits, source);

        float[] mono = new float[frames];
        for (int f = 0; f < frames; f++) {
            double sum = 0;
            for (int c = 0; c < channels; c++) {
                sum += reader.read(buf, f * frameSize + c * bytesPerSample);
            }
            mono[f] = (float) (sum / channels);
        }
        return mono;
    }

    private static SampleReader readerFor(AudioFormat.Encoding encoding, int bits, String source) {
        if (AudioFormat.Encoding.PCM_SIGNED.equals(encoding)) {
            switch (bits) {
                case 16:
                    return (b, i) -> b.getShort(i) / 32768.0f;
                case 24:
                    return AudioFileLoader::readInt24;
                case 32:
                    return (b, i) -> (float) (b.getInt(i) / 2147483648.0);
                default:
                    break;
            }
        } else if (AudioFormat.Encoding.PCM_UNSIGNED.equals(encoding) && bits == 8) {
            return (b, i) -> ((b.get(i) & 0xFF) - 128) / 128.0f;
        } else if (AudioFormat.Encoding.PCM_SIGNED.equals(encoding) && bits == 8) {
            return (b, i) -> b.get(i) / 128.0f;
        } else if (AudioFormat.Encoding.PCM_FLOAT.equals(encoding) && bits == 32) {
            return ByteBuffer::getFloat;
        }
        throw new InvalidAudioException(source, "unsupported encoding " + encoding + " " + bits + "-bit");
    }

    private static float readInt24(ByteBuffer b, int i) {
        int b0 = b.get(i) & 0xFF;
        int b1 = b.get(i + 1) & 0xFF;
        int b2 = b.get(i + 2);
        int value = b.order() == ByteOrder.LITTLE_ENDIAN
                ? (b2 << 16) | (b1 << 8) | b0
                : ((b.get(i) << 16) | (b1 << 8) | (b.get(i + 2) & 0xFF));
        return value / 8388608.0f;
    }

    @FunctionalInterface
    private interface SampleReader {
        float read(ByteBuffer buffer, int offset);
    }
}
