package com.signalrelay.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bar-level dedup record. One row per signal key that reached order placement.
 */
@Entity
@Table(name = "processed_signals", indexes = {
        @Index(name = "idx_signal_processed_at", columnList = "processedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedSignal {

    public static final int INSTRUMENT_LENGTH = 64;
    public static final int TIMEFRAME_LENGTH = 32;

    @Id
    @Column(length = 512)
    private String signalKey;

    @Column(length = 32)
    private String venue;

    @Column(length = INSTRUMENT_LENGTH)
    private String instrument;

    @Column(length = 8)
    private String side;

    @Column(length = TIMEFRAME_LENGTH)
    private String timeframe;

    private Long barTimeMs;

    @Column(nullable = false)
    private Instant processedAt;

    private String resultStatus;
}
