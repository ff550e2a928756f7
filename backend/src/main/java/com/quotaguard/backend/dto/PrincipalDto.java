package com.quotaguard.backend.dto;

import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.entity.PrincipalStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PrincipalDto {
    Long id;
    String email;
    String firstName;
    String lastName;
    String role;
    String tier;
    boolean emailVerified;
    PrincipalStatus status;
    LocalDateTime deletionScheduledAt;
    LocalDateTime deletedAt;
    String viewingAsTier;
    LocalDateTime overrideExpiresAt;
    LocalDateTime createdAt;

    public static PrincipalDto fromEntity(Principal principal) {
        return PrincipalDto.builder()
                .id(principal.getId())
                .email(principal.getEmail())
                .firstName(principal.getFirstName())
                .lastName(principal.getLastName())
                .role(principal.getRole())
                .tier(principal.getTier())
                .emailVerified(principal.isEmailVerified())
                .status(principal.getStatus())
                .deletionScheduledAt(principal.getDeletionScheduledAt())
                .deletedAt(principal.getDeletedAt())
                .viewingAsTier(principal.getViewingAsTier())
                .overrideExpiresAt(principal.getOverrideExpiresAt())
                .createdAt(principal.getCreatedAt())
                .build();
    }
}
