package com.quotaguard.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Account record whose usage is metered. Updates to the tracked columns are captured into
 * {@code principal_audit_log} by the change-capture listener; inserts are not.
 */
@Entity
@Table(name = "principals", indexes = {
        @Index(name = "idx_principals_role", columnList = "role"),
        @Index(name = "idx_principals_deletion_scheduled_at", columnList = "deletion_scheduled_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Principal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(nullable = false, length = 50)
    private String role;

    @Column(nullable = false, length = 32)
    private String tier;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "deletion_scheduled_at")
    private LocalDateTime deletionScheduledAt;

    @Column(name = "deletion_reason", columnDefinition = "TEXT")
    private String deletionReason;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    // admin/support "view as tier" testing
    @Column(name = "viewing_as_tier", length = 32)
    private String viewingAsTier;

    @Column(name = "override_expires_at")
    private LocalDateTime overrideExpiresAt;

    @Column(name = "override_reason", columnDefinition = "TEXT")
    private String overrideReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public Principal(String email, String firstName, String lastName, String role, String tier) {
        this.email = email;
        this.firstName = firstName;
        this.lastName = lastName;
        this.role = role;
        this.tier = tier;
    }

    public PrincipalStatus getStatus() {
        if (deletedAt != null) {
            return PrincipalStatus.EXPIRED;
        }
        if (deletionScheduledAt != null) {
            return PrincipalStatus.PENDING_DELETION;
        }
        return PrincipalStatus.ACTIVE;
    }

    public boolean hasActiveTierOverride(LocalDateTime now) {
        return viewingAsTier != null && overrideExpiresAt != null && overrideExpiresAt.isAfter(now);
    }

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    public void onUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
