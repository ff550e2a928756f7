package com.quotaguard.backend.config;

import java.time.Duration;
import java.time.Period;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retention")
@Getter
@Setter
public class RetentionProperties {

    /** Restore window between ScheduleDeletion and expiry. */
    private Duration gracePeriod = Duration.ofDays(30);

    /** How long archived audit history is kept before the sweep drops it. */
    private Period archiveRetention = Period.ofYears(7);

    private boolean sweepEnabled = true;

    private String sweepCron = "0 15 3 * * *";
}
