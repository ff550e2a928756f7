package com.quotaguard.backend.service;

import com.quotaguard.backend.audit.ChangeAttribution;
import com.quotaguard.backend.audit.ChangeAttributionHolder;
import com.quotaguard.backend.config.RetentionProperties;
import com.quotaguard.backend.dto.PurgeResultDto;
import com.quotaguard.backend.entity.ArchivedPrincipalAuditEntry;
import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.entity.PrincipalAuditEntry;
import com.quotaguard.backend.exception.InvalidRetentionStateException;
import com.quotaguard.backend.exception.RestrictedDeletionException;
import com.quotaguard.backend.repository.ArchivedPrincipalAuditEntryRepository;
import com.quotaguard.backend.repository.PrincipalAuditEntryRepository;
import com.quotaguard.backend.repository.PrincipalRepository;
import com.quotaguard.backend.repository.UsageCounterRepository;
import com.quotaguard.backend.service.event.AccountRestoredEvent;
import com.quotaguard.backend.service.event.DeletionScheduledEvent;
import com.quotaguard.backend.util.TimeUtil;
import jakarta.persistence.EntityNotFoundException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Deletion lifecycle of a principal: Active, PendingDeletion (restorable until the grace
 * deadline), Expired, and finally physical removal once its audit history has been archived.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionService {

    static final String DEFAULT_DELETION_REASON = "Account deletion requested";

    private final PrincipalRepository principalRepository;
    private final PrincipalAuditEntryRepository auditEntryRepository;
    private final ArchivedPrincipalAuditEntryRepository archivedEntryRepository;
    private final UsageCounterRepository counterRepository;
    private final RetentionProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final PlatformTransactionManager transactionManager;
    private final Clock clock;

    @Transactional
    public Principal scheduleDeletion(Long principalId, String reason) {
        Principal principal = principalRepository.findByIdAndDeletedAtIsNull(principalId)
                .orElseThrow(() -> new EntityNotFoundException("Principal not found: " + principalId));
        if (principal.getDeletionScheduledAt() != null) {
            throw new InvalidRetentionStateException("DELETION_ALREADY_SCHEDULED",
                    "Deletion is already scheduled for " + principal.getDeletionScheduledAt());
        }
        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_DELETION_REASON : reason.trim();
        LocalDateTime deadline = TimeUtil.now(clock).plus(properties.getGracePeriod());

        ChangeAttributionHolder.bind(new ChangeAttribution(principalId, effectiveReason,
                Map.of("trigger", "user_request")));
        principal.setDeletionScheduledAt(deadline);
        principal.setDeletionReason(effectiveReason);
        Principal saved = principalRepository.saveAndFlush(principal);

        eventPublisher.publishEvent(new DeletionScheduledEvent(saved.getId(), saved.getEmail(), deadline, effectiveReason));
        log.info("[RETENTION] principal={} deletion scheduled at {}", principalId, deadline);
        return saved;
    }

    @Transactional
    public Principal restoreAccount(Long principalId) {
        Principal principal = principalRepository.findById(principalId)
                .orElseThrow(() -> new EntityNotFoundException("Principal not found: " + principalId));
        if (principal.getDeletedAt() != null) {
            throw new InvalidRetentionStateException("ACCOUNT_EXPIRED", "Account has already expired and cannot be restored");
        }
        if (principal.getDeletionScheduledAt() == null) {
            throw new InvalidRetentionStateException("DELETION_NOT_SCHEDULED", "Account is not scheduled for deletion");
        }
        if (!principal.getDeletionScheduledAt().isAfter(TimeUtil.now(clock))) {
            throw new InvalidRetentionStateException("GRACE_PERIOD_ELAPSED",
                    "Restore window closed at " + principal.getDeletionScheduledAt());
        }

        ChangeAttributionHolder.bind(new ChangeAttribution(principalId, "Account restored by user",
                Map.of("trigger", "user_request")));
        principal.setDeletionScheduledAt(null);
        principal.setDeletionReason(null);
        Principal saved = principalRepository.saveAndFlush(principal);

        eventPublisher.publishEvent(new AccountRestoredEvent(saved.getId(), saved.getEmail()));
        log.info("[RETENTION] principal={} restored", principalId);
        return saved;
    }

    /**
     * Marks every principal whose grace deadline has passed as expired. Each row is handled in its
     * own transaction and re-checked after loading, so overlapping or repeated runs only ever apply
     * the marker once.
     *
     * @return number of principals expired by this run
     */
    public int expireOverdueDeletions() {
        LocalDateTime now = TimeUtil.now(clock);
        List<Long> candidates = principalRepository.findExpiredDeletionIds(now);
        if (candidates.isEmpty()) {
            return 0;
        }
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        int expired = 0;
        for (Long principalId : candidates) {
            try {
                Boolean applied = template.execute(status -> expireOne(principalId, now));
                if (Boolean.TRUE.equals(applied)) {
                    expired++;
                }
            } catch (ObjectOptimisticLockingFailureException ex) {
                log.info("[RETENTION] principal={} changed concurrently, leaving it to the other writer", principalId);
            } catch (RuntimeException ex) {
                log.error("[RETENTION] Failed to expire principal {}, continuing with the rest", principalId, ex);
            }
        }
        log.info("[RETENTION] Expired {} of {} overdue principals", expired, candidates.size());
        return expired;
    }

    /**
     * Moves the live audit history of a principal into the archive table. The principal row stays
     * locked until commit, and only the rows that were copied are removed.
     *
     * @return number of entries archived
     */
    @Transactional
    public int archiveAuditHistory(Long principalId) {
        lockPrincipal(principalId);
        return archiveLockedHistory(principalId);
    }

    private int archiveLockedHistory(Long principalId) {
        List<PrincipalAuditEntry> entries = auditEntryRepository.findByPrincipalIdOrderByIdAsc(principalId);
        if (entries.isEmpty()) {
            return 0;
        }
        LocalDateTime archivedAt = TimeUtil.now(clock);
        LocalDateTime retainUntil = archivedAt.plus(properties.getArchiveRetention());
        List<ArchivedPrincipalAuditEntry> archived = entries.stream()
                .map(entry -> ArchivedPrincipalAuditEntry.from(entry, archivedAt, retainUntil))
                .toList();
        archivedEntryRepository.saveAll(archived);
        archivedEntryRepository.flush();
        List<Long> copiedIds = entries.stream().map(PrincipalAuditEntry::getId).toList();
        int removed = auditEntryRepository.deleteByIdIn(copiedIds);
        log.info("[RETENTION] principal={} archived {} audit entries (retain until {})", principalId, removed, retainUntil);
        return archived.size();
    }

    /**
     * Physically deletes a principal row. Refused while live audit entries reference it; the
     * foreign key on the audit table enforces the same rule for any writer that slips in between.
     */
    @Transactional
    public void purgePrincipal(Long principalId) {
        Principal principal = principalRepository.findById(principalId)
                .orElseThrow(() -> new EntityNotFoundException("Principal not found: " + principalId));
        long liveEntries = auditEntryRepository.countByPrincipalId(principalId);
        if (liveEntries > 0) {
            throw new RestrictedDeletionException(principalId, liveEntries);
        }
        counterRepository.deleteByPrincipalId(principalId);
        try {
            principalRepository.delete(principal);
            principalRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            throw new RestrictedDeletionException(principalId, ex);
        }
        log.info("[RETENTION] principal={} purged", principalId);
    }

    @Transactional
    public PurgeResultDto archiveAndPurge(Long principalId) {
        Principal principal = lockPrincipal(principalId);
        if (principal.getDeletedAt() == null) {
            throw new InvalidRetentionStateException("PRINCIPAL_NOT_EXPIRED",
                    "Only expired principals can be archived and purged");
        }
        int archived = archiveLockedHistory(principalId);
        purgePrincipal(principalId);
        return new PurgeResultDto(principalId, archived);
    }

    /**
     * @return number of archived entries dropped because their retention ran out
     */
    @Transactional
    public int purgeExpiredArchives() {
        int removed = archivedEntryRepository.deleteExpired(TimeUtil.now(clock));
        if (removed > 0) {
            log.info("[RETENTION] Dropped {} archived audit entries past retention", removed);
        }
        return removed;
    }

    private Principal lockPrincipal(Long principalId) {
        return principalRepository.findByIdForUpdate(principalId)
                .orElseThrow(() -> new EntityNotFoundException("Principal not found: " + principalId));
    }

    private boolean expireOne(Long principalId, LocalDateTime now) {
        Principal principal = principalRepository.findById(principalId).orElse(null);
        if (principal == null
                || principal.getDeletedAt() != null
                || principal.getDeletionScheduledAt() == null
                || principal.getDeletionScheduledAt().isAfter(now)) {
            return false;
        }
        ChangeAttributionHolder.bind(ChangeAttribution.system("Deletion grace period elapsed", "deletion_sweep"));
        principal.setDeletedAt(now);
        principal.setFirstName(null);
        principal.setLastName(null);
        principal.setDeletionReason(null);
        principalRepository.saveAndFlush(principal);
        counterRepository.deleteByPrincipalId(principalId);
        return true;
    }
}
