package com.quotaguard.backend.exception;

/**
 * The audit companion of a principal change could not be written. Thrown from inside the flush,
 * so the field change is rolled back together with it.
 */
public class AuditWriteFailureException extends BizException {

    public AuditWriteFailureException(Long principalId, String detail, Throwable cause) {
        super("AUDIT_WRITE_FAILURE", "Audit entry for principal " + principalId + " could not be written: " + detail, cause);
    }
}
