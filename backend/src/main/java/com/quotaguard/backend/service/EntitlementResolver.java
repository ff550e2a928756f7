package com.quotaguard.backend.service;

import com.quotaguard.backend.config.QuotaProperties;
import com.quotaguard.backend.dto.EntitlementPolicy;
import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.entity.Role;
import com.quotaguard.backend.util.TimeUtil;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps a principal's current role and tier to the limits it is held to. Pure function of the
 * principal passed in; callers must hand it a freshly loaded row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EntitlementResolver {

    private final QuotaProperties properties;
    private final Clock clock;

    public EntitlementPolicy resolve(Principal principal) {
        Optional<Role> role = Role.fromCode(principal.getRole());
        if (role.isEmpty()) {
            log.warn("[QUOTA] Unknown role '{}' on principal {}, applying {} limits", principal.getRole(),
                    principal.getId(), properties.getFallbackTier());
            return policyFor(properties.getFallbackTier(), false);
        }
        if (!isBypassRole(role.get())) {
            return policyFor(principal.getTier(), false);
        }
        // an override only exists to let privileged staff see a lower tier's limits
        LocalDateTime now = TimeUtil.now(clock);
        if (principal.hasActiveTierOverride(now)) {
            return policyFor(principal.getViewingAsTier(), false);
        }
        return policyFor(principal.getTier(), true);
    }

    public boolean isBypassRole(Role role) {
        return role.isAtLeast(bypassRole());
    }

    private Role bypassRole() {
        return Role.fromCode(properties.getBypassRole()).orElse(Role.SUPPORT);
    }

    private EntitlementPolicy policyFor(String tier, boolean bypass) {
        QuotaProperties.TierLimits limits = tier == null ? null : properties.getTiers().get(tier);
        String effectiveTier = tier;
        if (limits == null) {
            effectiveTier = properties.getFallbackTier();
            limits = properties.getTiers().get(effectiveTier);
        }
        if (limits == null) {
            return new EntitlementPolicy(effectiveTier, 0, 0, bypass);
        }
        return new EntitlementPolicy(effectiveTier, limits.getDailyLimit(), limits.getMonthlyLimit(), bypass);
    }
}
