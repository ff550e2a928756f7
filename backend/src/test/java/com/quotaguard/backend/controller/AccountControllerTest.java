package com.quotaguard.backend.controller;

import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.filter.TrustedPrincipalHeaderFilter;
import com.quotaguard.backend.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AccountControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("A user can schedule deletion and restore within the grace period")
    void scheduleAndRestore() throws Exception {
        Principal user = givenPrincipal("user", "free");

        mockMvc.perform(post("/api/account/deletion")
                        .header(TrustedPrincipalHeaderFilter.HEADER, user.getId())
                        .contentType("application/json")
                        .content("{\"reason\": \"No longer needed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING_DELETION"))
                .andExpect(jsonPath("$.deletion_scheduled_at").value("2024-04-09T12:00:00"));

        mockMvc.perform(delete("/api/account/deletion").header(TrustedPrincipalHeaderFilter.HEADER, user.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));

        mockMvc.perform(delete("/api/account/deletion").header(TrustedPrincipalHeaderFilter.HEADER, user.getId()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DELETION_NOT_SCHEDULED"));
    }
}
