package com.signalrelay.backend.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    public static final String PROCESSED_SIGNAL_CACHE = "processedSignalCache";

    /**
     * Fast path for dedup lookups. Only ever holds keys known to be finalized;
     * the processed_signals table stays authoritative.
     */
    @Bean(PROCESSED_SIGNAL_CACHE)
    public Cache<String, Boolean> processedSignalCache(DedupProperties dedupProperties) {
        return Caffeine.newBuilder()
                .initialCapacity(64)
                .maximumSize(dedupProperties.getCacheMaxSize())
                .expireAfterWrite(dedupProperties.getCacheTtl())
                .recordStats()
                .build();
    }
}
