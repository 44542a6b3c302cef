package com.phillippitts.aura.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(2_500_000L)).isEqualTo(2L);
    }

    @Test
    void elapsedIsNonNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void remainingIsZeroOncePastDeadline() {
        long past = System.nanoTime() - 5 * TimeUtils.NANOS_PER_MILLI;
        long future = System.nanoTime() + 10_000 * TimeUtils.NANOS_PER_MILLI;

        assertThat(TimeUtils.remainingMillis(past)).isZero();
        assertThat(TimeUtils.remainingMillis(future)).isBetween(9_000L, 10_000L);
    }
}
