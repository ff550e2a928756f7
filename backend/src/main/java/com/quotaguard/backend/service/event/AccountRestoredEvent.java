package com.quotaguard.backend.service.event;

public record AccountRestoredEvent(Long principalId, String email) {
}
