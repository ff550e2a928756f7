package com.quotaguard.backend.service;

import com.quotaguard.backend.audit.ChangeAttributionHolder;
import com.quotaguard.backend.config.RetentionProperties;
import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.entity.PrincipalStatus;
import com.quotaguard.backend.repository.ArchivedPrincipalAuditEntryRepository;
import com.quotaguard.backend.repository.PrincipalAuditEntryRepository;
import com.quotaguard.backend.repository.PrincipalRepository;
import com.quotaguard.backend.repository.UsageCounterRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionServiceSweepTest {

    private static final Instant NOW = Instant.parse("2024-04-20T03:15:00Z");

    @Mock
    private PrincipalRepository principalRepository;

    @Mock
    private PrincipalAuditEntryRepository auditEntryRepository;

    @Mock
    private ArchivedPrincipalAuditEntryRepository archivedEntryRepository;

    @Mock
    private UsageCounterRepository counterRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private RetentionService retentionService;

    @BeforeEach
    void setUp() {
        retentionService = new RetentionService(principalRepository, auditEntryRepository, archivedEntryRepository,
                counterRepository, new RetentionProperties(), eventPublisher, transactionManager,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(transactionManager.getTransaction(any())).thenReturn(mock(TransactionStatus.class));
        // the mocked transaction manager does not start synchronization itself
        TransactionSynchronizationManager.initSynchronization();
    }

    @AfterEach
    void tearDown() {
        TransactionSynchronizationManager.unbindResourceIfPossible(ChangeAttributionHolder.class);
        TransactionSynchronizationManager.clearSynchronization();
    }

    @Test
    @DisplayName("A principal that fails to expire does not stop the rest of the run")
    void failedRowDoesNotAbortSweep() {
        LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
        Principal overdue = new Principal("overdue@example.com", "Over", "Due", "user", "free");
        overdue.setId(2L);
        overdue.setDeletionScheduledAt(now.minusDays(1));
        when(principalRepository.findExpiredDeletionIds(now)).thenReturn(List.of(1L, 2L));
        when(principalRepository.findById(1L)).thenThrow(new CannotAcquireLockException("lock timeout"));
        when(principalRepository.findById(2L)).thenReturn(Optional.of(overdue));
        when(principalRepository.saveAndFlush(overdue)).thenReturn(overdue);

        int expired = retentionService.expireOverdueDeletions();

        assertThat(expired).isEqualTo(1);
        assertThat(overdue.getStatus()).isEqualTo(PrincipalStatus.EXPIRED);
        assertThat(overdue.getDeletedAt()).isEqualTo(now);
        verify(counterRepository).deleteByPrincipalId(2L);
        verify(counterRepository, never()).deleteByPrincipalId(1L);
        verify(transactionManager).rollback(any());
    }
}
