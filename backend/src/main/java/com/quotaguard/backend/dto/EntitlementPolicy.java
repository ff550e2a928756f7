package com.quotaguard.backend.dto;

/**
 * Role-derived quota policy. Recomputed for every check and never persisted.
 */
public record EntitlementPolicy(String tier, int dailyLimit, int monthlyLimit, boolean bypass) {

    public static final int UNLIMITED = -1;

    public boolean isWithinLimits(long dailyUsed, long monthlyUsed) {
        return below(dailyLimit, dailyUsed) && below(monthlyLimit, monthlyUsed);
    }

    public static long remaining(int limit, long used) {
        return limit == UNLIMITED ? UNLIMITED : Math.max(0, limit - used);
    }

    private static boolean below(int limit, long used) {
        return limit == UNLIMITED || used < limit;
    }
}
