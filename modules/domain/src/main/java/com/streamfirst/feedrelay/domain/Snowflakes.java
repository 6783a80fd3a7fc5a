package com.streamfirst.feedrelay.domain;

import java.time.Instant;

/**
 * Conversion between instants and snowflake-style identifiers, which embed their creation time.
 */
public final class Snowflakes {

    /** 2015-01-01T00:00:00Z, the epoch the source feed counts identifiers from */
    public static final long EPOCH_MILLIS = 1_420_070_400_000L;

    private static final int TIMESTAMP_SHIFT = 22;

    private Snowflakes() {
    }

    /**
     * Returns the lowest identifier that could have been issued at {@code moment}.
     */
    public static long fromInstant(Instant moment) {
        long millis = moment.toEpochMilli() - EPOCH_MILLIS;
        if (millis < 0) {
            return 0L;
        }
        return millis << TIMESTAMP_SHIFT;
    }

    public static Instant toInstant(long snowflake) {
        return Instant.ofEpochMilli((snowflake >>> TIMESTAMP_SHIFT) + EPOCH_MILLIS);
    }
}
