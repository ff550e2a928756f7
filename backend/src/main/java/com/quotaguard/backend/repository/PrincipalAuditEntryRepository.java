package com.quotaguard.backend.repository;

import com.quotaguard.backend.entity.PrincipalAuditEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PrincipalAuditEntryRepository extends JpaRepository<PrincipalAuditEntry, Long> {

    List<PrincipalAuditEntry> findByPrincipalIdOrderByChangedAtDescIdDesc(Long principalId, Pageable pageable);

    List<PrincipalAuditEntry> findByPrincipalIdAndFieldNameOrderByChangedAtDescIdDesc(Long principalId, String fieldName, Pageable pageable);

    List<PrincipalAuditEntry> findByPrincipalIdOrderByIdAsc(Long principalId);

    long countByPrincipalId(Long principalId);

    // archival only
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from PrincipalAuditEntry e where e.id in :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);
}
