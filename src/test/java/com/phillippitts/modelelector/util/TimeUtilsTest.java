package com.phillippitts.modelelector.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(0)).isZero();
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1);
        assertThat(TimeUtils.nanosToMillis(5_999_999L)).isEqualTo(5);
    }

    @Test
    void shouldMeasureElapsedMillis() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(20);

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(20);
    }

    @Test
    void shouldNeverReportNegativeElapsedTime() {
        long future = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);

        assertThat(TimeUtils.elapsedMillis(future)).isZero();
    }
}
