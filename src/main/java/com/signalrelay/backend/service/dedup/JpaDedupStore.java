package com.signalrelay.backend.service.dedup;

import com.github.benmanes.caffeine.cache.Cache;
import com.signalrelay.backend.config.CacheConfig;
import com.signalrelay.backend.model.ProcessedSignal;
import com.signalrelay.backend.repository.ProcessedSignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;

/**
 * Dedup store backed by the processed_signals table with a Caffeine fast path.
 * The cache starts empty on every start and only ever holds keys that were seen
 * persisted, so it can short-circuit a lookup but never invent one.
 */
@Service
public class JpaDedupStore implements DedupStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaDedupStore.class);

    private final ProcessedSignalRepository repository;
    private final Cache<String, Boolean> processedCache;
    private final Clock clock;

    public JpaDedupStore(ProcessedSignalRepository repository,
                         @Qualifier(CacheConfig.PROCESSED_SIGNAL_CACHE) Cache<String, Boolean> processedCache,
                         Clock clock) {
        this.repository = repository;
        this.processedCache = processedCache;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isProcessed(String key) {
        if (processedCache.getIfPresent(key) != null) {
            return true;
        }
        boolean persisted = repository.existsById(key);
        if (persisted) {
            processedCache.put(key, Boolean.TRUE);
        }
        return persisted;
    }

    @Override
    @Transactional
    public void markProcessed(String key, SignalKeyMetadata metadata, String resultStatus) {
        ProcessedSignal record = repository.findById(key).orElseGet(ProcessedSignal::new);
        boolean existing = record.getSignalKey() != null;

        record.setSignalKey(key);
        record.setVenue(metadata.getVenue());
        record.setInstrument(metadata.getInstrument());
        record.setSide(metadata.getSide());
        record.setTimeframe(metadata.getTimeframe());
        record.setBarTimeMs(metadata.getBarTimeMs());
        record.setProcessedAt(Instant.now(clock));
        record.setResultStatus(resultStatus);
        repository.save(record);

        cacheAfterCommit(key);
        if (existing) {
            logger.info("Dedup record {} updated with status {}", key, resultStatus);
        } else {
            logger.info("Dedup record {} created with status {}", key, resultStatus);
        }
    }

    /**
     * The row is only written at commit, so the fast path learns about the key after that.
     */
    private void cacheAfterCommit(String key) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            processedCache.put(key, Boolean.TRUE);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                processedCache.put(key, Boolean.TRUE);
            }
        });
    }

    /**
     * Deletes records processed before {@code cutoff}. The fast path is left alone; it expires
     * on its own TTL, and a key it still holds is at most over-cautious.
     */
    @Transactional
    public int pruneOlderThan(Instant cutoff) {
        return repository.deleteProcessedBefore(cutoff);
    }

    @Override
    public long cacheSize() {
        processedCache.cleanUp();
        return processedCache.estimatedSize();
    }

    @Override
    public long persistedCount() {
        return repository.count();
    }
}
