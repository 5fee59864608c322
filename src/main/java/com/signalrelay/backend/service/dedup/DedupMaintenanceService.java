package com.signalrelay.backend.service.dedup;

import com.signalrelay.backend.config.DedupProperties;
import com.signalrelay.backend.repository.ProcessedEmailRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Age-based pruning of both dedup tables. Dedup only has to cover realistic redelivery
 * windows, so old records can go.
 */
@Service
public class DedupMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(DedupMaintenanceService.class);

    private final JpaDedupStore dedupStore;
    private final ProcessedEmailRepository processedEmailRepository;
    private final DedupProperties dedupProperties;
    private final Clock clock;

    public DedupMaintenanceService(JpaDedupStore dedupStore,
                                   ProcessedEmailRepository processedEmailRepository,
                                   DedupProperties dedupProperties,
                                   Clock clock) {
        this.dedupStore = dedupStore;
        this.processedEmailRepository = processedEmailRepository;
        this.dedupProperties = dedupProperties;
        this.clock = clock;
    }

    @Scheduled(cron = "${dedup.prune-cron:0 30 3 * * *}")
    public void pruneExpiredRecords() {
        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(dedupProperties.getRetentionDays()));
        try {
            int signals = dedupStore.pruneOlderThan(cutoff);
            int emails = processedEmailRepository.deleteProcessedBefore(cutoff);
            if (signals > 0 || emails > 0) {
                logger.info("Pruned {} signal and {} email dedup records older than {}", signals, emails, cutoff);
            }
        } catch (Exception e) {
            logger.error("Error pruning dedup records: {}", e.getMessage(), e);
        }
    }
}
