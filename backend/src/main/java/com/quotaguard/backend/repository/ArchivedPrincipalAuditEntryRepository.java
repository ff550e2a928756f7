package com.quotaguard.backend.repository;

import com.quotaguard.backend.entity.ArchivedPrincipalAuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ArchivedPrincipalAuditEntryRepository extends JpaRepository<ArchivedPrincipalAuditEntry, Long> {

    List<ArchivedPrincipalAuditEntry> findByPrincipalIdOrderByOriginalEntryIdAsc(Long principalId);

    long countByPrincipalId(Long principalId);

    @Modifying
    @Query("delete from ArchivedPrincipalAuditEntry a where a.retainUntil < :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
