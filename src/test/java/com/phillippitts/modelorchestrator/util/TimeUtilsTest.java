package com.phillippitts.modelorchestrator.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void elapsedMillisIsNeverNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime() + 5_000_000_000L)).isZero();
    }

    @Test
    void shouldCalculateElapsedMillis() throws InterruptedException {
        long start = System.nanoTime();

        Thread.sleep(10);

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(10L);
    }
}
