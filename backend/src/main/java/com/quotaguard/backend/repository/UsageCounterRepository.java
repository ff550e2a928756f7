package com.quotaguard.backend.repository;

import com.quotaguard.backend.entity.UsageCounter;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UsageCounterRepository extends JpaRepository<UsageCounter, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from UsageCounter c where c.principalId = :principalId")
    Optional<UsageCounter> findByPrincipalIdForUpdate(@Param("principalId") Long principalId);

    @Modifying
    @Query("delete from UsageCounter c where c.principalId = :principalId")
    int deleteByPrincipalId(@Param("principalId") Long principalId);
}
