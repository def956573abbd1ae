package com.phillippitts.speakstream.audio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WavWriterTest {

    @TempDir
    Path tmp;

    @Test
    void writesReadableMonoWavAtRequestedRate() throws Exception {
        byte[] pcm = new byte[3200];
        pcm[1] = 0x40;
        Path wav = tmp.resolve("out.wav");

        WavWriter.writePcm16LeMono(pcm, 8000, wav);

        assertThat(Files.size(wav)).isEqualTo(44 + 3200);
        try (AudioInputStream in = AudioSystem.getAudioInputStream(wav.toFile())) {
            AudioFormat format = in.getFormat();
            assertThat(format.getSampleRate()).isEqualTo(8000f);
            assertThat(format.getChannels()).isEqualTo(1);
            assertThat(format.getSampleSizeInBits()).isEqualTo(16);
            assertThat(in.readAllBytes()).containsExactly(pcm);
        }
    }
}
