package com.quotaguard.backend.controller;

import com.quotaguard.backend.auth.AuthPrincipal;
import com.quotaguard.backend.dto.PrincipalDto;
import com.quotaguard.backend.dto.ScheduleDeletionRequest;
import com.quotaguard.backend.service.RetentionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/account")
@RequiredArgsConstructor
public class AccountController {

    private final RetentionService retentionService;

    @PostMapping("/deletion")
    public ResponseEntity<PrincipalDto> scheduleDeletion(
            @AuthenticationPrincipal AuthPrincipal principal,
            @Valid @RequestBody(required = false) ScheduleDeletionRequest request
    ) {
        String reason = request == null ? null : request.getReason();
        return ResponseEntity.ok(PrincipalDto.fromEntity(retentionService.scheduleDeletion(principal.id(), reason)));
    }

    @DeleteMapping("/deletion")
    public ResponseEntity<PrincipalDto> restoreAccount(@AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(PrincipalDto.fromEntity(retentionService.restoreAccount(principal.id())));
    }
}
