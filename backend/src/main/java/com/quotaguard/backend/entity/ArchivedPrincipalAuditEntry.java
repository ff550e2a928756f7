package com.quotaguard.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Cold-storage copy of a {@link PrincipalAuditEntry}. Carries no foreign key so it outlives the
 * principal row; kept until {@code retainUntil}.
 */
@Entity
@Table(name = "archived_principal_audit_log", indexes = {
        @Index(name = "idx_archived_audit_principal", columnList = "principal_id"),
        @Index(name = "idx_archived_audit_retain_until", columnList = "retain_until")
})
@Getter
@Setter
@NoArgsConstructor
public class ArchivedPrincipalAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "original_entry_id", nullable = false)
    private Long originalEntryId;

    @Column(name = "principal_id", nullable = false)
    private Long principalId;

    @Column(name = "principal_email")
    private String principalEmail;

    @Column(name = "field_name", nullable = false, length = 100)
    private String fieldName;

    @Column(name = "old_value", columnDefinition = "TEXT")
    private String oldValue;

    @Column(name = "new_value", columnDefinition = "TEXT")
    private String newValue;

    @Column(name = "change_type", nullable = false, length = 20)
    private String changeType;

    @Column(name = "actor_id")
    private Long actorId;

    @Column(length = 1000)
    private String reason;

    @Column(name = "changed_at", nullable = false)
    private LocalDateTime changedAt;

    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "archived_at", nullable = false)
    private LocalDateTime archivedAt;

    @Column(name = "retain_until", nullable = false)
    private LocalDateTime retainUntil;

    public static ArchivedPrincipalAuditEntry from(PrincipalAuditEntry entry, LocalDateTime archivedAt, LocalDateTime retainUntil) {
        ArchivedPrincipalAuditEntry archived = new ArchivedPrincipalAuditEntry();
        archived.setOriginalEntryId(entry.getId());
        archived.setPrincipalId(entry.getPrincipalId());
        archived.setPrincipalEmail(entry.getPrincipalEmail());
        archived.setFieldName(entry.getFieldName());
        archived.setOldValue(entry.getOldValue());
        archived.setNewValue(entry.getNewValue());
        archived.setChangeType(entry.getChangeType());
        archived.setActorId(entry.getActorId());
        archived.setReason(entry.getReason());
        archived.setChangedAt(entry.getChangedAt());
        archived.setMetadata(entry.getMetadata());
        archived.setArchivedAt(archivedAt);
        archived.setRetainUntil(retainUntil);
        return archived;
    }
}
