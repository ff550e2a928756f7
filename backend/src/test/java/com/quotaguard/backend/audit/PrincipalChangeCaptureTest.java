package com.quotaguard.backend.audit;

import com.quotaguard.backend.dto.AuditEntryDto;
import com.quotaguard.backend.dto.RoleChangeResult;
import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.entity.PrincipalAuditEntry;
import com.quotaguard.backend.exception.AuditWriteFailureException;
import com.quotaguard.backend.exception.BizException;
import com.quotaguard.backend.service.AuditHistoryService;
import com.quotaguard.backend.service.PrincipalService;
import com.quotaguard.backend.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrincipalChangeCaptureTest extends IntegrationTestSupport {

    @Autowired
    private PrincipalService principalService;

    @Autowired
    private AuditHistoryService auditHistoryService;

    @Test
    @DisplayName("Creating a principal writes no audit entry")
    void insertIsNotAudited() {
        Principal principal = principalService.register("New.User@Example.com", "New", "User", null);

        assertThat(principal.getEmail()).isEqualTo("new.user@example.com");
        assertThat(principal.getRole()).isEqualTo("user");
        assertThat(auditEntryRepository.countByPrincipalId(principal.getId())).isZero();
    }

    @Test
    @DisplayName("Emails are lower-cased the same way whatever the default locale")
    void emailNormalizationIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Principal principal = principalService.register("TITLE@EXAMPLE.COM", "Ti", "Tle", null);

            assertThat(principal.getEmail()).isEqualTo("title@example.com");
            assertThat(principalRepository.findByEmail("title@example.com")).isPresent();
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("Row timestamps are UTC whatever the default time zone")
    void rowTimestampsAreUtc() {
        TimeZone original = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("Asia/Seoul"));
        try {
            Principal principal = principalService.register("zoned@example.com", "Zo", "Ned", null);

            assertThat(Duration.between(principal.getCreatedAt(), LocalDateTime.now(ZoneOffset.UTC)).abs())
                    .isLessThan(Duration.ofMinutes(5));
            assertThat(principal.getUpdatedAt()).isEqualTo(principal.getCreatedAt());
        } finally {
            TimeZone.setDefault(original);
        }
    }

    @Test
    @DisplayName("A role change writes one attributed entry")
    void roleChangeIsAttributed() {
        Principal principal = givenPrincipal("user", "free");
        Principal actor = givenPrincipal("admin", "free");

        principalService.updateRole(principal.getId(), "admin", actor.getId(), "Promoted to run the support rota");

        List<PrincipalAuditEntry> entries = auditEntryRepository.findByPrincipalIdOrderByIdAsc(principal.getId());
        assertThat(entries).hasSize(1);
        PrincipalAuditEntry entry = entries.get(0);
        assertThat(entry.getFieldName()).isEqualTo("role");
        assertThat(entry.getOldValue()).isEqualTo("user");
        assertThat(entry.getNewValue()).isEqualTo("admin");
        assertThat(entry.getChangeType()).isEqualTo("update");
        assertThat(entry.getActorId()).isEqualTo(actor.getId());
        assertThat(entry.getReason()).isEqualTo("Promoted to run the support rota");
        assertThat(entry.getPrincipalEmail()).isEqualTo(principal.getEmail());
        assertThat(entry.getMetadata()).contains("\"changed_via\":\"change_capture_listener\"");
    }

    @Test
    @DisplayName("Each changed field in one update gets its own entry")
    void oneEntryPerChangedField() {
        Principal principal = givenPrincipal("user", "free");

        principalService.updateName(principal.getId(), "Renamed", "Person", null);

        assertThat(auditEntryRepository.findByPrincipalIdOrderByIdAsc(principal.getId()))
                .extracting(PrincipalAuditEntry::getFieldName)
                .containsExactlyInAnyOrder("first_name", "last_name");
    }

    @Test
    @DisplayName("A role round trip leaves two entries and the original role")
    void roleRoundTrip() {
        Principal principal = givenPrincipal("user", "free");

        principalService.updateRole(principal.getId(), "admin", null, "Temporary elevation");
        principalService.updateRole(principal.getId(), "user", null, "Elevation ended");

        List<AuditEntryDto> history = auditHistoryService.getRoleHistory(principal.getId());
        assertThat(history).hasSize(2);
        assertThat(history.get(0).getOldValue()).isEqualTo("admin");
        assertThat(history.get(0).getNewValue()).isEqualTo("user");
        assertThat(history.get(1).getOldValue()).isEqualTo("user");
        assertThat(history.get(1).getNewValue()).isEqualTo("admin");
        assertThat(principalRepository.findById(principal.getId())).get()
                .extracting(Principal::getRole).isEqualTo("user");
    }

    @Test
    @DisplayName("An unknown role is rejected and nothing is written")
    void unknownRoleRejected() {
        Principal principal = givenPrincipal("user", "free");

        RoleChangeResult result = principalService.updateRole(principal.getId(), "overlord", null, null);

        assertThat(result.isRejected()).isTrue();
        assertThat(auditEntryRepository.countByPrincipalId(principal.getId())).isZero();
        assertThat(principalRepository.findById(principal.getId())).get()
                .extracting(Principal::getRole).isEqualTo("user");
    }

    @Test
    @DisplayName("Setting the current role again is not a change")
    void unchangedRoleWritesNothing() {
        Principal principal = givenPrincipal("support", "free");

        RoleChangeResult result = principalService.updateRole(principal.getId(), "support", null, null);

        assertThat(result.getOutcome()).isEqualTo(RoleChangeResult.Outcome.UNCHANGED);
        assertThat(auditEntryRepository.countByPrincipalId(principal.getId())).isZero();
    }

    @Test
    @DisplayName("A bulk role update audits every principal independently")
    void bulkUpdateAuditsEachRow() {
        Principal first = givenPrincipal("user", "free");
        Principal second = givenPrincipal("user", "free");
        Principal third = givenPrincipal("user", "free");

        List<RoleChangeResult> results = principalService.updateRoles(
                List.of(first.getId(), second.getId(), third.getId()), "support", null, "Support onboarding");

        assertThat(results).allMatch(RoleChangeResult::isApplied);
        for (Principal principal : List.of(first, second, third)) {
            List<PrincipalAuditEntry> entries = auditEntryRepository.findByPrincipalIdOrderByIdAsc(principal.getId());
            assertThat(entries).hasSize(1);
            assertThat(entries.get(0).getNewValue()).isEqualTo("support");
            assertThat(entries.get(0).getMetadata()).contains("\"bulk\":true");
        }
    }

    @Test
    @DisplayName("A change whose audit entry cannot be written is rolled back")
    void auditFailureRollsBackChange() {
        Principal principal = givenPrincipal("user", "free");
        String oversizedReason = "x".repeat(1001);

        assertThatThrownBy(() -> principalService.updateRole(principal.getId(), "admin", null, oversizedReason))
                .isInstanceOf(AuditWriteFailureException.class);

        assertThat(principalRepository.findById(principal.getId())).get()
                .extracting(Principal::getRole).isEqualTo("user");
        assertThat(auditEntryRepository.countByPrincipalId(principal.getId())).isZero();
    }

    @Test
    @DisplayName("Saving through the repository directly is captured with the default reason")
    void directRepositorySaveIsCaptured() {
        Principal principal = givenPrincipal("user", "free");

        principal.setTier("pro");
        principalRepository.save(principal);

        List<PrincipalAuditEntry> entries = auditEntryRepository.findByPrincipalIdOrderByIdAsc(principal.getId());
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getFieldName()).isEqualTo("tier");
        assertThat(entries.get(0).getActorId()).isNull();
        assertThat(entries.get(0).getReason()).isEqualTo(ChangeAttribution.DEFAULT_REASON);
    }

    @Test
    @DisplayName("Entries keep the email the principal had when they were written")
    void emailSnapshotIsKept() {
        Principal principal = givenPrincipal("user", "free");
        String originalEmail = principal.getEmail();

        principalService.markEmailVerified(principal.getId());
        principalService.updateEmail(principal.getId(), "changed@example.com", principal.getId(), "User changed address");

        List<PrincipalAuditEntry> entries = auditEntryRepository.findByPrincipalIdOrderByIdAsc(principal.getId());
        assertThat(entries).extracting(PrincipalAuditEntry::getFieldName)
                .containsExactly("email_verified", "email");
        assertThat(entries.get(0).getPrincipalEmail()).isEqualTo(originalEmail);
        assertThat(entries.get(1).getOldValue()).isEqualTo(originalEmail);
        assertThat(entries.get(1).getNewValue()).isEqualTo("changed@example.com");
        assertThat(entries.get(1).getPrincipalEmail()).isEqualTo("changed@example.com");
    }

    @Test
    @DisplayName("Reading history twice returns the same entries and writes nothing")
    void historyReadIsIdempotent() {
        Principal principal = givenPrincipal("user", "free");
        principalService.updateTier(principal.getId(), "pro", null, "Upgraded");
        principalService.updateRole(principal.getId(), "support", null, "Joined support");

        List<AuditEntryDto> first = auditHistoryService.getAuditHistory(principal.getId(), null, null);
        List<AuditEntryDto> second = auditHistoryService.getAuditHistory(principal.getId(), null, null);

        assertThat(second).isEqualTo(first);
        assertThat(first).extracting(AuditEntryDto::getFieldName).containsExactly("role", "tier");
        assertThat(auditEntryRepository.countByPrincipalId(principal.getId())).isEqualTo(2);
    }

    @Test
    @DisplayName("History can be narrowed to one field and limited")
    void historyFilterAndLimit() {
        Principal principal = givenPrincipal("user", "free");
        principalService.updateTier(principal.getId(), "pro", null, null);
        principalService.updateRole(principal.getId(), "support", null, null);
        principalService.updateRole(principal.getId(), "admin", null, null);

        assertThat(auditHistoryService.getAuditHistory(principal.getId(), "tier", null)).hasSize(1);
        assertThat(auditHistoryService.getAuditHistory(principal.getId(), "role", 1))
                .singleElement()
                .extracting(AuditEntryDto::getNewValue)
                .isEqualTo("admin");
    }

    @Test
    @DisplayName("Asking for an untracked field is an error")
    void unknownFieldRejected() {
        Principal principal = givenPrincipal("user", "free");

        assertThatThrownBy(() -> auditHistoryService.getAuditHistory(principal.getId(), "password", null))
                .isInstanceOf(BizException.class)
                .hasMessageContaining("password");
    }
}
