package com.quotaguard.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Daily and monthly usage counters of one principal. Windows are rolled over lazily when read:
 * once {@code now} reaches {@code periodStart + length} the count restarts at zero and the window
 * starts at {@code now}.
 */
@Entity
@Table(name = "usage_counters")
@Getter
@Setter
@NoArgsConstructor
public class UsageCounter {

    @Id
    @Column(name = "principal_id", nullable = false)
    private Long principalId;

    @Column(name = "daily_count", nullable = false)
    private long dailyCount;

    @Column(name = "daily_period_start", nullable = false)
    private LocalDateTime dailyPeriodStart;

    @Column(name = "monthly_count", nullable = false)
    private long monthlyCount;

    @Column(name = "monthly_period_start", nullable = false)
    private LocalDateTime monthlyPeriodStart;

    @Version
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public UsageCounter(Long principalId, LocalDateTime now) {
        this.principalId = principalId;
        this.dailyPeriodStart = now;
        this.monthlyPeriodStart = now;
        this.updatedAt = now;
    }

    public UsageSnapshot snapshot(LocalDateTime now) {
        boolean dailyExpired = !now.isBefore(UsageSnapshot.dailyEnd(dailyPeriodStart));
        boolean monthlyExpired = !now.isBefore(UsageSnapshot.monthlyEnd(monthlyPeriodStart));
        return new UsageSnapshot(
                dailyExpired ? 0 : dailyCount,
                dailyExpired ? now : dailyPeriodStart,
                monthlyExpired ? 0 : monthlyCount,
                monthlyExpired ? now : monthlyPeriodStart
        );
    }

    /**
     * Rolls the windows over (if due) and adds {@code amount} to both counters.
     */
    public UsageSnapshot record(long amount, LocalDateTime now) {
        UsageSnapshot current = snapshot(now);
        this.dailyCount = current.dailyCount() + amount;
        this.dailyPeriodStart = current.dailyPeriodStart();
        this.monthlyCount = current.monthlyCount() + amount;
        this.monthlyPeriodStart = current.monthlyPeriodStart();
        this.updatedAt = now;
        return snapshot(now);
    }
}
