package com.quotaguard.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Counter update kept colliding with concurrent writers. Safe to retry.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class TransientStoreConflictException extends BizException {

    private final int attempts;

    public TransientStoreConflictException(Long principalId, int attempts, Throwable cause) {
        super("TRANSIENT_STORE_CONFLICT",
                "Usage counter for principal " + principalId + " is busy after " + attempts + " attempt(s); retry the request",
                cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
