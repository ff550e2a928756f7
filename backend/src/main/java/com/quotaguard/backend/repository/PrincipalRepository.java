package com.quotaguard.backend.repository;

import com.quotaguard.backend.entity.Principal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Tracked principal columns are only ever changed through managed entities so the
 * change-capture listener sees every row; do not add bulk update queries here.
 */
public interface PrincipalRepository extends JpaRepository<Principal, Long> {
    Optional<Principal> findByEmail(String email);
    Optional<Principal> findByIdAndDeletedAtIsNull(Long id);

    // blocks tracked-column updates, and so new audit rows, until the caller commits
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Principal p WHERE p.id = :id")
    Optional<Principal> findByIdForUpdate(@Param("id") Long id);

    @Query("""
        SELECT p.id FROM Principal p
        WHERE p.deletionScheduledAt IS NOT NULL
          AND p.deletionScheduledAt <= :now
          AND p.deletedAt IS NULL
        ORDER BY p.deletionScheduledAt ASC
        """)
    List<Long> findExpiredDeletionIds(@Param("now") LocalDateTime now);
}
