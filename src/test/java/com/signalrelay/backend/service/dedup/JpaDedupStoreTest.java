package com.signalrelay.backend.service.dedup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.signalrelay.backend.config.CacheConfig;
import com.signalrelay.backend.model.ProcessedSignal;
import com.signalrelay.backend.repository.ProcessedSignalRepository;
import com.signalrelay.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import({JpaDedupStore.class, JpaDedupStoreTest.TestBeans.class})
public class JpaDedupStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    @TestConfiguration
    static class TestBeans {
        @Bean
        @Primary
        MutableClock clock() {
            return new MutableClock(START);
        }

        @Bean(CacheConfig.PROCESSED_SIGNAL_CACHE)
        Cache<String, Boolean> processedSignalCache() {
            return Caffeine.newBuilder().maximumSize(100).build();
        }
    }

    @Autowired
    private JpaDedupStore dedupStore;

    @Autowired
    private ProcessedSignalRepository repository;

    @Autowired
    @Qualifier(CacheConfig.PROCESSED_SIGNAL_CACHE)
    private Cache<String, Boolean> cache;

    @Autowired
    private MutableClock clock;

    private final SignalKeyMetadata metadata = new SignalKeyMetadata("MEXC", "ETHUSDT", "long", "15", 1714521600000L);

    @BeforeEach
    void setUp() {
        cache.invalidateAll();
        clock.set(START);
    }

    @Test
    void markProcessed_shouldPersistAndBeVisible() {
        String key = metadata.toKey();
        assertFalse(dedupStore.isProcessed(key));

        dedupStore.markProcessed(key, metadata, "ok");

        assertTrue(dedupStore.isProcessed(key));
        assertEquals(1L, dedupStore.persistedCount());
        ProcessedSignal stored = repository.findById(key).orElseThrow();
        assertEquals("MEXC", stored.getVenue());
        assertEquals("ETHUSDT", stored.getInstrument());
        assertEquals(1714521600000L, stored.getBarTimeMs());
        assertEquals(START, stored.getProcessedAt());
    }

    @Test
    void markProcessed_twice_shouldOverwriteWithoutSecondRecord() {
        String key = metadata.toKey();

        dedupStore.markProcessed(key, metadata, "order_failed");
        assertTrue(dedupStore.isProcessed(key));
        dedupStore.markProcessed(key, metadata, "ok");

        assertTrue(dedupStore.isProcessed(key));
        assertEquals(1L, repository.count());
        assertEquals("ok", repository.findById(key).orElseThrow().getResultStatus());
    }

    @Test
    void isProcessed_withColdCache_shouldFallBackToPersistentStore() {
        String key = metadata.toKey();
        dedupStore.markProcessed(key, metadata, "ok");

        cache.invalidateAll();
        assertEquals(0L, dedupStore.cacheSize());

        assertTrue(dedupStore.isProcessed(key));
        assertEquals(1L, dedupStore.cacheSize());
    }

    @Test
    void pruneOlderThan_shouldDeleteOnlyExpiredRecords() {
        SignalKeyMetadata older = new SignalKeyMetadata("MEXC", "BTCUSDT", "short", "60", 1714000000000L);
        dedupStore.markProcessed(older.toKey(), older, "ok");
        clock.advance(Duration.ofDays(40));
        dedupStore.markProcessed(metadata.toKey(), metadata, "ok");

        int deleted = dedupStore.pruneOlderThan(clock.instant().minus(Duration.ofDays(30)));

        assertEquals(1, deleted);
        assertFalse(repository.existsById(older.toKey()));
        assertTrue(repository.existsById(metadata.toKey()));
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void markProcessed_committed_shouldWarmFastPath() {
        SignalKeyMetadata committed = new SignalKeyMetadata("MEXC", "SOLUSDT", "short", "5", 1714521900000L);
        String key = committed.toKey();
        try {
            dedupStore.markProcessed(key, committed, "ok");

            assertNotNull(cache.getIfPresent(key));
            assertTrue(repository.existsById(key));
        } finally {
            repository.deleteById(key);
        }
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void markProcessed_whenCommitFails_shouldLeaveFastPathEmpty() {
        SignalKeyMetadata oversized = new SignalKeyMetadata("MEXC", "ETHUSDT", "long", "x".repeat(300), 1714521600000L);
        String key = oversized.toKey();

        assertThrows(DataIntegrityViolationException.class, () -> dedupStore.markProcessed(key, oversized, "ok"));

        assertNull(cache.getIfPresent(key));
        assertFalse(repository.existsById(key));
        assertFalse(dedupStore.isProcessed(key));
    }
}
