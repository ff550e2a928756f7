package com.quotaguard.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Physical removal of a principal that still has live audit history.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class RestrictedDeletionException extends BizException {

    public static final String REQUIRED_STEP = "archive-and-purge";

    private final Long principalId;

    public RestrictedDeletionException(Long principalId, long auditEntries) {
        super("RESTRICTED_DELETION", message(principalId, auditEntries + " audit entries still reference it"));
        this.principalId = principalId;
    }

    public RestrictedDeletionException(Long principalId, Throwable cause) {
        super("RESTRICTED_DELETION", message(principalId, "audit entries still reference it"), cause);
        this.principalId = principalId;
    }

    public Long getPrincipalId() {
        return principalId;
    }

    public String getRequiredStep() {
        return REQUIRED_STEP;
    }

    private static String message(Long principalId, String detail) {
        return "Principal " + principalId + " cannot be deleted: " + detail
                + ". Run " + REQUIRED_STEP + " to archive its history first.";
    }
}
