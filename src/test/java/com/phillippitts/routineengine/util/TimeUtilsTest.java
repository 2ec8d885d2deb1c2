package com.phillippitts.routineengine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(1_000L);
        assertThat(elapsedMs).isLessThan(2_000L);
    }

    @Test
    void shouldCalculateZeroElapsedForCurrentTime() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isLessThan(50L);
    }

    @Test
    void shouldUseCorrectNanosPerMilliConstant() {
        assertThat(TimeUtils.NANOS_PER_MILLI).isEqualTo(1_000_000L);
    }
}
