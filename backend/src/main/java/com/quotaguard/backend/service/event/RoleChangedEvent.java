package com.quotaguard.backend.service.event;

public record RoleChangedEvent(Long principalId, String previousRole, String newRole, Long actorId) {
}
