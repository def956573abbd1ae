package com.phillippitts.speakstream.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeUtilsTest {

    @Test
    void elapsedMillisIsNonNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0);
    }

    @Test
    void convertsSecondsToMillis() {
        assertThat(TimeUtils.secondsToMillis(0.42)).isEqualTo(420.0, org.assertj.core.api.Assertions.within(1e-9));
    }

    @Test
    void audioMillisUsesSampleRate() {
        assertThat(TimeUtils.audioMillis(16000, 16000)).isEqualTo(1000);
        assertThat(TimeUtils.audioMillis(800, 8000)).isEqualTo(100);
        assertThatThrownBy(() -> TimeUtils.audioMillis(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
