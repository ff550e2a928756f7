package com.quotaguard.backend.service.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
public class PrincipalLifecycleEventLogger {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRoleChanged(RoleChangedEvent event) {
        log.info("[ROLE] principal={} {} -> {} by actor={}", event.principalId(), event.previousRole(),
                event.newRole(), event.actorId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDeletionScheduled(DeletionScheduledEvent event) {
        log.info("[RETENTION] principal={} scheduled for deletion at {}", event.principalId(),
                event.deletionScheduledAt());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAccountRestored(AccountRestoredEvent event) {
        log.info("[RETENTION] principal={} restored", event.principalId());
    }
}
