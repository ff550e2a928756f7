package com.quotaguard.backend.dto;

import com.quotaguard.backend.entity.PrincipalAuditEntry;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AuditEntryDto {
    Long id;
    Long principalId;
    String principalEmail;
    String fieldName;
    String oldValue;
    String newValue;
    String changeType;
    Long actorId;
    String reason;
    LocalDateTime changedAt;
    String metadata;

    public static AuditEntryDto fromEntity(PrincipalAuditEntry entry) {
        return AuditEntryDto.builder()
                .id(entry.getId())
                .principalId(entry.getPrincipalId())
                .principalEmail(entry.getPrincipalEmail())
                .fieldName(entry.getFieldName())
                .oldValue(entry.getOldValue())
                .newValue(entry.getNewValue())
                .changeType(entry.getChangeType())
                .actorId(entry.getActorId())
                .reason(entry.getReason())
                .changedAt(entry.getChangedAt())
                .metadata(entry.getMetadata())
                .build();
    }
}
