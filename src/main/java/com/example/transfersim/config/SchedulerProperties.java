package com.example.transfersim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scheduler.transfer-maintenance")
public class SchedulerProperties {

    // Stale PENDING redispatch
    /**
     * Cron expression for re-publishing saga requests of stuck PENDING transfers.
     * Example: "0 * * * * ?" for every minute
     */
    private String redispatchCron;

    /**
     * How old (in seconds) a PENDING transfer must be before its saga request is re-sent.
     * Keep this well above normal MQ latency so healthy transfers are not re-sent.
     */
    private int redispatchDelaySeconds;

    /**
     * Maximum number of PENDING transfers to redispatch per execution.
     */
    private int redispatchBatchSize;

    /**
     * Maximum lock duration in seconds for the redispatch job.
     */
    private int redispatchLockAtMostSeconds;

    /**
     * Minimum lock duration in seconds for the redispatch job.
     */
    private int redispatchLockAtLeastSeconds;

    // Expiry reaper
    /**
     * Cron expression for moving overdue PENDING / RESOLVING transfers to EXPIRED.
     */
    private String expiryCron;

    /**
     * Maximum number of transfers to expire per execution.
     */
    private int expiryBatchSize;

    /**
     * Maximum lock duration in seconds for the expiry job.
     */
    private int expiryLockAtMostSeconds;

    /**
     * Minimum lock duration in seconds for the expiry job.
     */
    private int expiryLockAtLeastSeconds;
}
