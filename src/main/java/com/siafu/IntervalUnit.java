package com.siafu;

import java.time.Duration;

/** The period a {@link RecurringInterval} steps by. */
public enum IntervalUnit {
    SECONDLY(Duration.ofSeconds(1), "second"),
    MINUTELY(Duration.ofMinutes(1), "minute"),
    HOURLY(Duration.ofHours(1), "hour"),
    DAILY(Duration.ofDays(1), "day"),
    WEEKLY(Duration.ofDays(7), "week"),
    /** Calendar months; there is no fixed length. */
    MONTHLY(null, "month");

    private final Duration fixedLength;
    private final String displayName;

    IntervalUnit(Duration fixedLength, String displayName) {
        this.fixedLength = fixedLength;
        this.displayName = displayName;
    }

    public boolean isFixedLength() {
        return fixedLength != null;
    }

    Duration fixedLength() {
        return fixedLength;
    }

    String displayName() {
        return displayName;
    }
}
