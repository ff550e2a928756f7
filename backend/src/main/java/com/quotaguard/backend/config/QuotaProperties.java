package com.quotaguard.backend.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Entitlement and ledger settings. Tier limits of {@code -1} mean unlimited.
 */
@ConfigurationProperties(prefix = "quota")
@Getter
@Setter
public class QuotaProperties {

    /** Lowest role whose quota checks are bypassed (usage is still recorded). */
    private String bypassRole = "support";

    /** Attempts for a counter update that hits lock or insert contention. */
    private int maxAttempts = 3;

    /** Default lifetime of an admin tier override. */
    private int tierOverrideHours = 4;

    /** Tier used when a principal's role or tier is not recognised. */
    private String fallbackTier = "free";

    private Map<String, TierLimits> tiers = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class TierLimits {
        private int dailyLimit;
        private int monthlyLimit;
    }
}
