package com.quotaguard.backend.dto;

import com.quotaguard.backend.entity.Principal;
import lombok.Value;

/**
 * Result of a role update. An unknown target role is a {@link Outcome#REJECTED} result and
 * nothing is written.
 */
@Value
public class RoleChangeResult {

    public enum Outcome {
        APPLIED,
        UNCHANGED,
        REJECTED
    }

    Outcome outcome;
    Long principalId;
    String previousRole;
    String requestedRole;
    String message;
    PrincipalDto principal;

    public static RoleChangeResult applied(Principal principal, String previousRole) {
        return new RoleChangeResult(Outcome.APPLIED, principal.getId(), previousRole, principal.getRole(),
                null, PrincipalDto.fromEntity(principal));
    }

    public static RoleChangeResult unchanged(Principal principal) {
        return new RoleChangeResult(Outcome.UNCHANGED, principal.getId(), principal.getRole(), principal.getRole(),
                "Principal already has role " + principal.getRole(), PrincipalDto.fromEntity(principal));
    }

    public static RoleChangeResult rejected(Long principalId, String requestedRole, String message) {
        return new RoleChangeResult(Outcome.REJECTED, principalId, null, requestedRole, message, null);
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    public boolean isRejected() {
        return outcome == Outcome.REJECTED;
    }
}
