package com.quotaguard.backend.controller;

import com.quotaguard.backend.auth.AuthPrincipal;
import com.quotaguard.backend.dto.QuotaDecision;
import com.quotaguard.backend.dto.UsageSummary;
import com.quotaguard.backend.service.QuotaLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/quota")
@RequiredArgsConstructor
public class QuotaController {

    private final QuotaLedgerService quotaLedgerService;

    @GetMapping("/me")
    public ResponseEntity<QuotaDecision> checkQuota(@AuthenticationPrincipal AuthPrincipal principal) {
        return toResponse(quotaLedgerService.checkQuota(principal.id()));
    }

    /**
     * Atomically checks and consumes one unit.
     */
    @PostMapping("/me/consume")
    public ResponseEntity<QuotaDecision> consume(@AuthenticationPrincipal AuthPrincipal principal) {
        return toResponse(quotaLedgerService.checkAndIncrement(principal.id()));
    }

    @PostMapping("/me/usage")
    public ResponseEntity<UsageSummary> recordUsage(@AuthenticationPrincipal AuthPrincipal principal) {
        quotaLedgerService.recordUsage(principal.id());
        return ResponseEntity.ok(quotaLedgerService.getUsageSummary(principal.id()));
    }

    @GetMapping("/me/summary")
    public ResponseEntity<UsageSummary> getSummary(@AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(quotaLedgerService.getUsageSummary(principal.id()));
    }

    private static ResponseEntity<QuotaDecision> toResponse(QuotaDecision decision) {
        if (!decision.isAllowed()) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(decision);
        }
        return ResponseEntity.ok(decision);
    }
}
