package com.phillippitts.sttpool.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_500_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime();

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void remainingMillisCountsDownAndNeverGoesNegative() {
        long future = System.nanoTime() + 10_000 * TimeUtils.NANOS_PER_MILLI;
        long past = System.nanoTime() - 10_000 * TimeUtils.NANOS_PER_MILLI;

        assertThat(TimeUtils.remainingMillis(future)).isBetween(9_000L, 10_000L);
        assertThat(TimeUtils.remainingMillis(past)).isZero();
    }
}
