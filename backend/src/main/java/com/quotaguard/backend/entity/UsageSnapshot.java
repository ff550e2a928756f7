package com.quotaguard.backend.entity;

import java.time.LocalDateTime;

/**
 * Counter values as they stand at a given instant, after lazy rollover.
 */
public record UsageSnapshot(long dailyCount,
                            LocalDateTime dailyPeriodStart,
                            long monthlyCount,
                            LocalDateTime monthlyPeriodStart) {

    public static UsageSnapshot empty(LocalDateTime now) {
        return new UsageSnapshot(0, now, 0, now);
    }

    public LocalDateTime dailyResetAt() {
        return dailyEnd(dailyPeriodStart);
    }

    public LocalDateTime monthlyResetAt() {
        return monthlyEnd(monthlyPeriodStart);
    }

    static LocalDateTime dailyEnd(LocalDateTime start) {
        return start.plusDays(1);
    }

    static LocalDateTime monthlyEnd(LocalDateTime start) {
        return start.plusMonths(1);
    }
}
