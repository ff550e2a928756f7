package com.quotaguard.backend.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

public final class TimeUtil {

    private TimeUtil() {
    }

    /**
     * Current UTC time truncated to the precision the database keeps, so a value read back
     * compares equal to the value that was written.
     */
    public static LocalDateTime now(Clock clock) {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
