package com.signalrelay.backend.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Cached view of one instrument's position. Side, size and entry are overwritten from the
 * venue before every decision; {@code cooldownUntil} is the only field owned locally.
 * Mutated only while the instrument's lock is held.
 */
@Getter
public class PositionRecord {

    private final String instrument;
    private PositionSide side = PositionSide.FLAT;
    private BigDecimal entryPrice;
    private BigDecimal size = BigDecimal.ZERO;
    private Instant cooldownUntil = Instant.EPOCH;
    private Instant reconciledAt;

    public PositionRecord(String instrument) {
        this.instrument = instrument;
    }

    /**
     * Overwrites side, size and entry. Keeps size non-negative and entry defined only while
     * a position is open.
     */
    public void applyExchangeState(PositionSide side, BigDecimal size, BigDecimal entryPrice, Instant at) {
        BigDecimal magnitude = size == null ? BigDecimal.ZERO : size.abs();
        if (side == null || side == PositionSide.FLAT || magnitude.signum() == 0) {
            this.side = PositionSide.FLAT;
            this.size = BigDecimal.ZERO;
            this.entryPrice = null;
        } else {
            this.side = side;
            this.size = magnitude;
            this.entryPrice = entryPrice;
        }
        this.reconciledAt = at;
    }

    public void armCooldown(Instant until) {
        this.cooldownUntil = until;
    }

    public boolean inCooldown(Instant now) {
        return now.isBefore(cooldownUntil);
    }

    public PositionSnapshot snapshot() {
        return new PositionSnapshot(instrument, side, entryPrice, size, cooldownUntil, reconciledAt);
    }
}
