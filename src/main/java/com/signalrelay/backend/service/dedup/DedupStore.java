package com.signalrelay.backend.service.dedup;

/**
 * Records which signals have been finalized. Survives restarts.
 */
public interface DedupStore {

    boolean isProcessed(String key);

    /**
     * Idempotent upsert: marking an existing key overwrites metadata and status, it never
     * creates a second record.
     */
    void markProcessed(String key, SignalKeyMetadata metadata, String resultStatus);

    /** Number of keys held by the in-process fast path. */
    long cacheSize();

    /** Number of persisted records. */
    long persistedCount();
}
