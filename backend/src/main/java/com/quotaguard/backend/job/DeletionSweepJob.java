package com.quotaguard.backend.job;

import com.quotaguard.backend.service.RetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly retention sweep: expires principals past their grace deadline and drops archived
 * audit history past its retention. Safe to run on several nodes at once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "retention", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class DeletionSweepJob {

    private final RetentionService retentionService;

    @Scheduled(cron = "${retention.sweep-cron:0 15 3 * * *}")
    public void sweep() {
        int expired = retentionService.expireOverdueDeletions();
        int dropped = retentionService.purgeExpiredArchives();
        log.info("[RETENTION] Sweep finished: expired={}, archived entries dropped={}", expired, dropped);
    }
}
