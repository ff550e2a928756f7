package com.quotaguard.backend.controller;

import com.quotaguard.backend.auth.AuthPrincipal;
import com.quotaguard.backend.dto.AuditEntryDto;
import com.quotaguard.backend.dto.BulkUpdateRoleRequest;
import com.quotaguard.backend.dto.PrincipalDto;
import com.quotaguard.backend.dto.PurgeResultDto;
import com.quotaguard.backend.dto.RoleChangeResult;
import com.quotaguard.backend.dto.TierOverrideRequest;
import com.quotaguard.backend.dto.UpdateRoleRequest;
import com.quotaguard.backend.dto.UsageSummary;
import com.quotaguard.backend.service.AuditHistoryService;
import com.quotaguard.backend.service.PrincipalService;
import com.quotaguard.backend.service.QuotaLedgerService;
import com.quotaguard.backend.service.RetentionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin/principals")
@RequiredArgsConstructor
public class AdminPrincipalController {

    private final PrincipalService principalService;
    private final QuotaLedgerService quotaLedgerService;
    private final AuditHistoryService auditHistoryService;
    private final RetentionService retentionService;

    @GetMapping("/{principalId}")
    public ResponseEntity<PrincipalDto> getPrincipal(@PathVariable Long principalId) {
        return ResponseEntity.ok(PrincipalDto.fromEntity(principalService.getPrincipal(principalId)));
    }

    @GetMapping("/{principalId}/usage")
    public ResponseEntity<UsageSummary> getUsage(@PathVariable Long principalId) {
        return ResponseEntity.ok(quotaLedgerService.getUsageSummary(principalId));
    }

    @PatchMapping("/{principalId}/role")
    public ResponseEntity<RoleChangeResult> updateRole(
            @PathVariable Long principalId,
            @Valid @RequestBody UpdateRoleRequest request,
            @AuthenticationPrincipal AuthPrincipal principal
    ) {
        RoleChangeResult result = principalService.updateRole(principalId, request.getRole(), principal.id(), request.getReason());
        if (result.isRejected()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @PatchMapping("/roles")
    public ResponseEntity<List<RoleChangeResult>> updateRoles(
            @Valid @RequestBody BulkUpdateRoleRequest request,
            @AuthenticationPrincipal AuthPrincipal principal
    ) {
        return ResponseEntity.ok(principalService.updateRoles(request.getPrincipalIds(), request.getRole(),
                principal.id(), request.getReason()));
    }

    @PostMapping("/{principalId}/tier-override")
    public ResponseEntity<PrincipalDto> applyTierOverride(
            @PathVariable Long principalId,
            @Valid @RequestBody TierOverrideRequest request
    ) {
        return ResponseEntity.ok(PrincipalDto.fromEntity(principalService.applyTierOverride(principalId,
                request.getTier(), request.getReason(), request.getHours())));
    }

    @DeleteMapping("/{principalId}/tier-override")
    public ResponseEntity<PrincipalDto> clearTierOverride(@PathVariable Long principalId) {
        return ResponseEntity.ok(PrincipalDto.fromEntity(principalService.clearTierOverride(principalId)));
    }

    @GetMapping("/{principalId}/audit")
    public ResponseEntity<List<AuditEntryDto>> getAuditHistory(
            @PathVariable Long principalId,
            @RequestParam(value = "field", required = false) String field,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(auditHistoryService.getAuditHistory(principalId, field, limit));
    }

    @PostMapping("/{principalId}/archive-and-purge")
    public ResponseEntity<PurgeResultDto> archiveAndPurge(@PathVariable Long principalId) {
        return ResponseEntity.ok(retentionService.archiveAndPurge(principalId));
    }
}
