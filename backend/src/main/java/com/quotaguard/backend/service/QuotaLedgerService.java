package com.quotaguard.backend.service;

import com.quotaguard.backend.config.QuotaProperties;
import com.quotaguard.backend.dto.EntitlementPolicy;
import com.quotaguard.backend.dto.QuotaDecision;
import com.quotaguard.backend.dto.UsageSummary;
import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.entity.UsageCounter;
import com.quotaguard.backend.entity.UsageSnapshot;
import com.quotaguard.backend.exception.TransientStoreConflictException;
import com.quotaguard.backend.repository.PrincipalRepository;
import com.quotaguard.backend.repository.UsageCounterRepository;
import com.quotaguard.backend.util.TimeUtil;
import jakarta.persistence.EntityNotFoundException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Per-principal usage counters with lazy daily and monthly rollover.
 *
 * <p>Every increment reads the counter row under a write lock, so concurrent callers for the
 * same principal serialize on that row. The first increment of a principal inserts the row and
 * may race another first increment; the loser retries in a fresh transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaLedgerService {

    private final UsageCounterRepository counterRepository;
    private final PrincipalRepository principalRepository;
    private final EntitlementResolver entitlementResolver;
    private final QuotaProperties properties;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    /**
     * Evaluates the live policy against current usage without consuming anything.
     */
    @Transactional(readOnly = true)
    public QuotaDecision checkQuota(Long principalId) {
        EntitlementPolicy policy = entitlementResolver.resolve(loadPrincipal(principalId));
        UsageSnapshot usage = currentUsage(principalId, TimeUtil.now(clock));
        boolean allowed = policy.bypass() || policy.isWithinLimits(usage.dailyCount(), usage.monthlyCount());
        return QuotaDecision.of(policy, usage, allowed);
    }

    public QuotaDecision checkAndIncrement(Long principalId) {
        return withRetry(principalId, () -> {
            EntitlementPolicy policy = entitlementResolver.resolve(loadPrincipal(principalId));
            return incrementIfAllowed(principalId, policy);
        });
    }

    /**
     * Consumes one unit if {@code policy} allows it. Bypass policies always consume.
     */
    public QuotaDecision checkAndIncrement(Long principalId, EntitlementPolicy policy) {
        return withRetry(principalId, () -> incrementIfAllowed(principalId, policy));
    }

    /**
     * Unconditional increment, for usage that has already happened.
     */
    public UsageSnapshot recordUsage(Long principalId) {
        return withRetry(principalId, () -> {
            loadPrincipal(principalId);
            LocalDateTime now = TimeUtil.now(clock);
            UsageCounter counter = lockCounter(principalId, now);
            UsageSnapshot usage = counter.record(1, now);
            counterRepository.saveAndFlush(counter);
            return usage;
        });
    }

    @Transactional(readOnly = true)
    public UsageSummary getUsageSummary(Long principalId) {
        EntitlementPolicy policy = entitlementResolver.resolve(loadPrincipal(principalId));
        return UsageSummary.of(policy, currentUsage(principalId, TimeUtil.now(clock)));
    }

    private QuotaDecision incrementIfAllowed(Long principalId, EntitlementPolicy policy) {
        LocalDateTime now = TimeUtil.now(clock);
        UsageCounter counter = lockCounter(principalId, now);
        UsageSnapshot usage = counter.snapshot(now);
        boolean allowed = policy.bypass() || policy.isWithinLimits(usage.dailyCount(), usage.monthlyCount());
        if (allowed) {
            usage = counter.record(1, now);
            counterRepository.saveAndFlush(counter);
        } else {
            log.debug("[QUOTA] principal={} over limit (daily {}/{}, monthly {}/{})", principalId,
                    usage.dailyCount(), policy.dailyLimit(), usage.monthlyCount(), policy.monthlyLimit());
        }
        return QuotaDecision.of(policy, usage, allowed);
    }

    private UsageCounter lockCounter(Long principalId, LocalDateTime now) {
        return counterRepository.findByPrincipalIdForUpdate(principalId)
                .orElseGet(() -> counterRepository.saveAndFlush(new UsageCounter(principalId, now)));
    }

    private UsageSnapshot currentUsage(Long principalId, LocalDateTime now) {
        return counterRepository.findById(principalId)
                .map(counter -> counter.snapshot(now))
                .orElseGet(() -> UsageSnapshot.empty(now));
    }

    private Principal loadPrincipal(Long principalId) {
        return principalRepository.findByIdAndDeletedAtIsNull(principalId)
                .orElseThrow(() -> new EntityNotFoundException("Principal not found: " + principalId));
    }

    private <T> T withRetry(Long principalId, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            // a failed statement has already doomed the caller's transaction
            try {
                return work.get();
            } catch (ConcurrencyFailureException | DataIntegrityViolationException ex) {
                throw new TransientStoreConflictException(principalId, 1, ex);
            }
        }
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return template.execute(status -> work.get());
            } catch (ConcurrencyFailureException | DataIntegrityViolationException ex) {
                lastFailure = ex;
                log.warn("[QUOTA] Counter conflict for principal {} (attempt {}/{}): {}", principalId, attempt,
                        maxAttempts, ex.getMessage());
            }
        }
        throw new TransientStoreConflictException(principalId, maxAttempts, lastFailure);
    }
}
