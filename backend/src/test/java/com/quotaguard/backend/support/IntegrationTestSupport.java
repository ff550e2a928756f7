package com.quotaguard.backend.support;

import com.quotaguard.backend.entity.Principal;
import com.quotaguard.backend.repository.ArchivedPrincipalAuditEntryRepository;
import com.quotaguard.backend.repository.PrincipalAuditEntryRepository;
import com.quotaguard.backend.repository.PrincipalRepository;
import com.quotaguard.backend.repository.UsageCounterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared Spring context for the H2-backed tests. Every test starts from empty tables with the
 * clock reset to {@link TestClockConfiguration#START}.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
public abstract class IntegrationTestSupport {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected PrincipalRepository principalRepository;

    @Autowired
    protected PrincipalAuditEntryRepository auditEntryRepository;

    @Autowired
    protected ArchivedPrincipalAuditEntryRepository archivedEntryRepository;

    @Autowired
    protected UsageCounterRepository counterRepository;

    @BeforeEach
    void resetState() {
        clock.setInstant(TestClockConfiguration.START);
        archivedEntryRepository.deleteAllInBatch();
        auditEntryRepository.deleteAllInBatch();
        counterRepository.deleteAllInBatch();
        principalRepository.deleteAllInBatch();
    }

    /**
     * Inserts a principal directly. Inserts are never audited, so the row starts with an empty
     * history whatever its role.
     */
    protected Principal givenPrincipal(String role, String tier) {
        String email = "principal" + SEQUENCE.incrementAndGet() + "@example.com";
        return principalRepository.saveAndFlush(new Principal(email, "Test", "Principal", role, tier));
    }
}
