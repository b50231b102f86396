package com.tanumd.core.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Timestamps}.
 */
class TimestampsTest {

    @Test
    void nowUtc_isTruncatedToMillis() {
        Instant now = Timestamps.nowUtc();

        assertThat(now).isEqualTo(now.truncatedTo(ChronoUnit.MILLIS));
    }

    @Test
    void advance_futurePrevious_keepsPrevious() {
        Instant future = Timestamps.nowUtc().plus(1, ChronoUnit.HOURS);

        assertThat(Timestamps.advance(future)).isEqualTo(future);
    }

    @Test
    void advance_pastPrevious_movesForward() {
        Instant past = Instant.parse("2020-01-01T00:00:00Z");

        assertThat(Timestamps.advance(past)).isAfter(past);
    }
}
