package com.quotaguard.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One captured change of one tracked principal field. Rows are inserted only by the
 * change-capture listener and removed only when archived; there are no setters.
 *
 * <p>The {@code principal} association exists to put a non-cascading foreign key on
 * {@code principal_id}: a principal with live audit rows cannot be physically deleted.
 */
@Entity
@Table(name = "principal_audit_log", indexes = {
        @Index(name = "idx_principal_audit_principal_field", columnList = "principal_id, field_name, changed_at"),
        @Index(name = "idx_principal_audit_actor", columnList = "actor_id"),
        @Index(name = "idx_principal_audit_changed_at", columnList = "changed_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PrincipalAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "principal_id", nullable = false, updatable = false)
    private Long principalId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "principal_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_principal_audit_principal"))
    private Principal principal;

    // email as it was when the change was written
    @Column(name = "principal_email", updatable = false)
    private String principalEmail;

    @Column(name = "field_name", nullable = false, length = 100, updatable = false)
    private String fieldName;

    @Column(name = "old_value", columnDefinition = "TEXT", updatable = false)
    private String oldValue;

    @Column(name = "new_value", columnDefinition = "TEXT", updatable = false)
    private String newValue;

    @Column(name = "change_type", nullable = false, length = 20, updatable = false)
    private String changeType;

    @Column(name = "actor_id", updatable = false)
    private Long actorId;

    @Column(length = 1000, updatable = false)
    private String reason;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private LocalDateTime changedAt;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata;
}
