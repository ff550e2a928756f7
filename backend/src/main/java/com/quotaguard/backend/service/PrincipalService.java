package com.quotaguard.backend.service;

import com.quotaguard.backend.audit.ChangeAttribution;
import com.quotaguard.backend.audit.ChangeAttributionHolder;
import com.quotaguard.backend.config.QuotaProperties;
import com.quotaguard.backend.dto.RoleChangeResult;
import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.entity.Role;
import com.quotaguard.backend.entity.Tier;
import com.quotaguard.backend.exception.BizException;
import com.quotaguard.backend.repository.PrincipalRepository;
import com.quotaguard.backend.service.event.RoleChangedEvent;
import com.quotaguard.backend.util.TimeUtil;
import jakarta.persistence.EntityNotFoundException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Mutations of principal rows. Each mutating method binds who is acting before touching the
 * entity; the change-capture listener picks that up when the update is flushed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrincipalService {

    private static final int MIN_OVERRIDE_REASON_LENGTH = 10;

    private final PrincipalRepository principalRepository;
    private final EntitlementResolver entitlementResolver;
    private final QuotaProperties quotaProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Principal register(String email, String firstName, String lastName, String tier) {
        String normalizedEmail = normalizeEmail(email);
        if (principalRepository.findByEmail(normalizedEmail).isPresent()) {
            throw new BizException("EMAIL_TAKEN", "Email already registered: " + normalizedEmail);
        }
        String tierCode = tier == null ? Tier.FREE.code() : requireTier(tier).code();
        Principal principal = new Principal(normalizedEmail, firstName, lastName, Role.USER.code(), tierCode);
        return principalRepository.saveAndFlush(principal);
    }

    @Transactional(readOnly = true)
    public Principal getPrincipal(Long principalId) {
        return loadActive(principalId);
    }

    /**
     * Changes a principal's role. An unrecognised role is rejected before anything is loaded or
     * written.
     */
    @Transactional
    public RoleChangeResult updateRole(Long principalId, String newRole, Long actorId, String reason) {
        Optional<Role> target = Role.fromCode(newRole);
        if (target.isEmpty()) {
            log.info("[ROLE] Rejected unknown role '{}' for principal {}", newRole, principalId);
            return RoleChangeResult.rejected(principalId, newRole, "Unknown role: " + newRole);
        }
        Principal principal = loadActive(principalId);
        ChangeAttributionHolder.bind(ChangeAttribution.of(actorId, reason));
        return applyRole(principal, target.get(), actorId);
    }

    /**
     * Bulk role change. Every principal is loaded and updated on its own row so each one gets its
     * own audit entries; ids that do not resolve to a live principal are reported as rejected.
     */
    @Transactional
    public List<RoleChangeResult> updateRoles(List<Long> principalIds, String newRole, Long actorId, String reason) {
        Optional<Role> target = Role.fromCode(newRole);
        List<RoleChangeResult> results = new ArrayList<>();
        if (target.isEmpty()) {
            for (Long principalId : principalIds) {
                results.add(RoleChangeResult.rejected(principalId, newRole, "Unknown role: " + newRole));
            }
            return results;
        }
        ChangeAttributionHolder.bind(new ChangeAttribution(actorId, reason,
                Map.of("bulk", true, "batch_size", principalIds.size())));
        for (Long principalId : new LinkedHashSet<>(principalIds)) {
            Optional<Principal> principal = principalRepository.findByIdAndDeletedAtIsNull(principalId);
            if (principal.isEmpty()) {
                results.add(RoleChangeResult.rejected(principalId, newRole, "Principal not found"));
                continue;
            }
            results.add(applyRole(principal.get(), target.get(), actorId));
        }
        log.info("[ROLE] Bulk update to {} by actor={}: {} principals", newRole, actorId, results.size());
        return results;
    }

    @Transactional
    public Principal updateEmail(Long principalId, String email, Long actorId, String reason) {
        String normalizedEmail = normalizeEmail(email);
        Principal principal = loadActive(principalId);
        if (normalizedEmail.equals(principal.getEmail())) {
            return principal;
        }
        principalRepository.findByEmail(normalizedEmail).ifPresent(other -> {
            throw new BizException("EMAIL_TAKEN", "Email already registered: " + normalizedEmail);
        });
        ChangeAttributionHolder.bind(ChangeAttribution.of(actorId, reason));
        principal.setEmail(normalizedEmail);
        return principalRepository.saveAndFlush(principal);
    }

    @Transactional
    public Principal updateName(Long principalId, String firstName, String lastName, Long actorId) {
        Principal principal = loadActive(principalId);
        ChangeAttributionHolder.bind(ChangeAttribution.of(actorId, null));
        principal.setFirstName(firstName);
        principal.setLastName(lastName);
        return principalRepository.saveAndFlush(principal);
    }

    @Transactional
    public Principal updateTier(Long principalId, String tier, Long actorId, String reason) {
        Tier target = requireTier(tier);
        Principal principal = loadActive(principalId);
        ChangeAttributionHolder.bind(ChangeAttribution.of(actorId, reason));
        principal.setTier(target.code());
        return principalRepository.saveAndFlush(principal);
    }

    @Transactional
    public Principal markEmailVerified(Long principalId) {
        Principal principal = loadActive(principalId);
        if (principal.isEmailVerified()) {
            return principal;
        }
        ChangeAttributionHolder.bind(ChangeAttribution.system("Email address verified", "email_verification"));
        principal.setEmailVerified(true);
        return principalRepository.saveAndFlush(principal);
    }

    /**
     * Lets a privileged principal experience a lower tier for a limited time. While the override
     * is active the principal loses its quota bypass.
     */
    @Transactional
    public Principal applyTierOverride(Long principalId, String tier, String reason, Integer hours) {
        Tier target = requireTier(tier);
        if (reason == null || reason.trim().length() < MIN_OVERRIDE_REASON_LENGTH) {
            throw new BizException("OVERRIDE_REASON_REQUIRED",
                    "Tier override requires a reason of at least " + MIN_OVERRIDE_REASON_LENGTH + " characters");
        }
        Principal principal = loadActive(principalId);
        Role role = Role.fromCode(principal.getRole()).orElse(Role.USER);
        if (!entitlementResolver.isBypassRole(role)) {
            throw new BizException("OVERRIDE_NOT_ALLOWED", "Tier override is only available to privileged roles");
        }
        int duration = hours == null ? quotaProperties.getTierOverrideHours() : hours;
        LocalDateTime expiresAt = TimeUtil.now(clock).plusHours(duration);
        principal.setViewingAsTier(target.code());
        principal.setOverrideExpiresAt(expiresAt);
        principal.setOverrideReason(reason.trim());
        log.info("[QUOTA] principal={} viewing as tier {} until {}", principalId, target.code(), expiresAt);
        return principalRepository.saveAndFlush(principal);
    }

    @Transactional
    public Principal clearTierOverride(Long principalId) {
        Principal principal = loadActive(principalId);
        principal.setViewingAsTier(null);
        principal.setOverrideExpiresAt(null);
        principal.setOverrideReason(null);
        return principalRepository.saveAndFlush(principal);
    }

    private RoleChangeResult applyRole(Principal principal, Role target, Long actorId) {
        String previousRole = principal.getRole();
        if (target.code().equals(previousRole)) {
            return RoleChangeResult.unchanged(principal);
        }
        principal.setRole(target.code());
        if (principal.getViewingAsTier() != null && !entitlementResolver.isBypassRole(target)) {
            principal.setViewingAsTier(null);
            principal.setOverrideExpiresAt(null);
            principal.setOverrideReason(null);
        }
        Principal saved = principalRepository.saveAndFlush(principal);
        eventPublisher.publishEvent(new RoleChangedEvent(saved.getId(), previousRole, saved.getRole(), actorId));
        return RoleChangeResult.applied(saved, previousRole);
    }

    private Principal loadActive(Long principalId) {
        return principalRepository.findByIdAndDeletedAtIsNull(principalId)
                .orElseThrow(() -> new EntityNotFoundException("Principal not found: " + principalId));
    }

    private static Tier requireTier(String tier) {
        return Tier.fromCode(tier)
                .orElseThrow(() -> new BizException("UNKNOWN_TIER", "Unknown tier: " + tier));
    }

    private static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new BizException("INVALID_EMAIL", "Email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
