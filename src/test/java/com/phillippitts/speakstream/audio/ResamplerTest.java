package com.phillippitts.speakstream.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResamplerTest {

    @Test
    void sameRateReturnsInput() {
        float[] in = {0.1f, 0.2f};

        assertThat(Resampler.linear(in, 16000, 16000)).isSameAs(in);
    }

    @Test
    void downsamplingHalvesLength() {
        float[] in = new float[8000];

        assertThat(Resampler.linear(in, 8000, 4000)).hasSize(4000);
    }

    @Test
    void upsamplingInterpolatesBetweenSamples() {
        float[] out = Resampler.linear(new float[] {0.0f, 1.0f}, 8000, 16000);

        assertThat(out).hasSize(4);
        assertThat(out[0]).isZero();
        assertThat(out[1]).isCloseTo(0.5f, within(1e-6f));
        assertThat(out[2]).isEqualTo(1.0f);
    }

    @Test
    void rejectsNonPositiveRates() {
        assertThatThrownBy(() -> Resampler.linear(new float[1], 0, 16000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
