package com.quotaguard.backend.service.event;

import java.time.LocalDateTime;

/**
 * Published when a principal enters the deletion grace period. Collaborators outside this
 * service (billing, notifications) react to it after commit.
 */
public record DeletionScheduledEvent(Long principalId, String email, LocalDateTime deletionScheduledAt, String reason) {
}
