package com.quotaguard.backend.dto;

import com.quotaguard.backend.entity.UsageSnapshot;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a quota check. Being over the limit is a normal decision ({@code allowed=false}
 * with a concrete {@code resetAt}), never an exception. {@code remaining} is -1 when unlimited.
 */
@Value
@Builder
public class QuotaDecision {
    boolean allowed;
    boolean bypass;
    long remaining;
    LocalDateTime resetAt;
    String tier;
    long dailyUsed;
    int dailyLimit;
    long monthlyUsed;
    int monthlyLimit;

    public static QuotaDecision of(EntitlementPolicy policy, UsageSnapshot usage, boolean allowed) {
        long dailyRemaining = EntitlementPolicy.remaining(policy.dailyLimit(), usage.dailyCount());
        long monthlyRemaining = EntitlementPolicy.remaining(policy.monthlyLimit(), usage.monthlyCount());
        boolean monthlyExhausted = monthlyRemaining == 0;
        return QuotaDecision.builder()
                .allowed(allowed)
                .bypass(policy.bypass())
                .remaining(bindingRemaining(dailyRemaining, monthlyRemaining))
                .resetAt(!allowed && monthlyExhausted ? usage.monthlyResetAt() : usage.dailyResetAt())
                .tier(policy.tier())
                .dailyUsed(usage.dailyCount())
                .dailyLimit(policy.dailyLimit())
                .monthlyUsed(usage.monthlyCount())
                .monthlyLimit(policy.monthlyLimit())
                .build();
    }

    private static long bindingRemaining(long daily, long monthly) {
        if (daily == EntitlementPolicy.UNLIMITED) {
            return monthly;
        }
        if (monthly == EntitlementPolicy.UNLIMITED) {
            return daily;
        }
        return Math.min(daily, monthly);
    }
}
