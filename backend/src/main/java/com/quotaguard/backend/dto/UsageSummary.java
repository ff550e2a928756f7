package com.quotaguard.backend.dto;

import com.quotaguard.backend.entity.UsageSnapshot;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Usage for display. Percentages are clamped to 100 while the counts are the true stored values,
 * which can exceed the limit after a demotion from a bypass role.
 */
@Value
@Builder
public class UsageSummary {
    String tier;
    boolean bypass;
    long dailyUsed;
    int dailyLimit;
    int dailyPercent;
    LocalDateTime dailyResetAt;
    long monthlyUsed;
    int monthlyLimit;
    int monthlyPercent;
    LocalDateTime monthlyResetAt;

    public static UsageSummary of(EntitlementPolicy policy, UsageSnapshot usage) {
        return UsageSummary.builder()
                .tier(policy.tier())
                .bypass(policy.bypass())
                .dailyUsed(usage.dailyCount())
                .dailyLimit(policy.dailyLimit())
                .dailyPercent(percent(usage.dailyCount(), policy.dailyLimit()))
                .dailyResetAt(usage.dailyResetAt())
                .monthlyUsed(usage.monthlyCount())
                .monthlyLimit(policy.monthlyLimit())
                .monthlyPercent(percent(usage.monthlyCount(), policy.monthlyLimit()))
                .monthlyResetAt(usage.monthlyResetAt())
                .build();
    }

    static int percent(long used, int limit) {
        if (limit == EntitlementPolicy.UNLIMITED) {
            return 0;
        }
        if (limit == 0) {
            return 100;
        }
        return (int) Math.min(100, used * 100 / limit);
    }
}
