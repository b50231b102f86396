package com.tanumd.core.util;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * UTC timestamps for manifest bookkeeping.
 *
 * <p>Values are truncated to milliseconds so they survive a JSON round trip unchanged.
 */
public final class Timestamps {

    private static final Clock UTC = Clock.systemUTC();

    private Timestamps() {
        // Utility class
    }

    /**
     * Returns the current UTC instant, truncated to milliseconds.
     *
     * @return now
     */
    public static Instant nowUtc() {
        return Instant.now(UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Returns a timestamp that is never earlier than {@code previous}.
     *
     * @param previous last recorded timestamp
     * @return the later of now and {@code previous}
     */
    public static Instant advance(Instant previous) {
        Instant now = nowUtc();
        return previous != null && previous.isAfter(now) ? previous : now;
    }
}
