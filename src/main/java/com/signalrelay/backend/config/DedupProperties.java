package com.signalrelay.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "dedup")
public class DedupProperties {

    /** Processed signal and email records older than this are pruned. */
    private int retentionDays = 30;

    private long cacheMaxSize = 10_000;

    private Duration cacheTtl = Duration.ofHours(24);

    /** Cron for the daily prune job, read by the scheduler through its placeholder. */
    private String pruneCron = "0 30 3 * * *";
}
