package com.quotaguard.backend.audit;

import com.quotaguard.backend.entity.AuditChangeType;
import java.util.Arrays;
import java.util.Optional;

/**
 * Principal fields whose changes are captured. Adding a field here is all it takes to audit
 * it; the audit table stores the name and text values generically.
 */
public enum TrackedField {
    ROLE("role", "role", false),
    EMAIL("email", "email", false),
    FIRST_NAME("first_name", "firstName", false),
    LAST_NAME("last_name", "lastName", false),
    TIER("tier", "tier", false),
    EMAIL_VERIFIED("email_verified", "emailVerified", false),
    DELETION_SCHEDULED_AT("deletion_scheduled_at", "deletionScheduledAt", true),
    DELETED_AT("deleted_at", "deletedAt", true);

    private final String fieldName;
    private final String property;
    private final boolean deletionMarker;

    TrackedField(String fieldName, String property, boolean deletionMarker) {
        this.fieldName = fieldName;
        this.property = property;
        this.deletionMarker = deletionMarker;
    }

    public String fieldName() {
        return fieldName;
    }

    public String property() {
        return property;
    }

    public AuditChangeType changeType(String oldValue, String newValue) {
        if (deletionMarker && newValue != null) {
            return AuditChangeType.DELETE;
        }
        if (deletionMarker && oldValue != null) {
            return AuditChangeType.RESTORE;
        }
        return AuditChangeType.UPDATE;
    }

    public static Optional<TrackedField> fromFieldName(String fieldName) {
        return Arrays.stream(values()).filter(field -> field.fieldName.equals(fieldName)).findFirst();
    }
}
