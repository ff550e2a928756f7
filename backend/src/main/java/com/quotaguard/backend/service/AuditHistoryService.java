package com.quotaguard.backend.service;

import com.quotaguard.backend.audit.TrackedField;
import com.quotaguard.backend.dto.AuditEntryDto;
import com.quotaguard.backend.exception.BizException;
import com.quotaguard.backend.repository.PrincipalAuditEntryRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AuditHistoryService {

    public static final int DEFAULT_LIMIT = 100;
    private static final int MAX_LIMIT = 1000;

    private final PrincipalAuditEntryRepository auditEntryRepository;

    /**
     * Live audit entries of a principal, newest first, optionally narrowed to one field.
     */
    @Transactional(readOnly = true)
    public List<AuditEntryDto> getAuditHistory(Long principalId, String fieldName, Integer limit) {
        Pageable page = PageRequest.of(0, clamp(limit));
        if (fieldName == null || fieldName.isBlank()) {
            return auditEntryRepository.findByPrincipalIdOrderByChangedAtDescIdDesc(principalId, page)
                    .stream()
                    .map(AuditEntryDto::fromEntity)
                    .toList();
        }
        TrackedField field = TrackedField.fromFieldName(fieldName.trim())
                .orElseThrow(() -> new BizException("UNKNOWN_FIELD", "Field is not audited: " + fieldName));
        return auditEntryRepository.findByPrincipalIdAndFieldNameOrderByChangedAtDescIdDesc(principalId, field.fieldName(), page)
                .stream()
                .map(AuditEntryDto::fromEntity)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AuditEntryDto> getRoleHistory(Long principalId) {
        return getAuditHistory(principalId, TrackedField.ROLE.fieldName(), DEFAULT_LIMIT);
    }

    private static int clamp(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
