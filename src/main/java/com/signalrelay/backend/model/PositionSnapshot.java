package com.signalrelay.backend.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/** Read-only copy of a {@link PositionRecord} for the status surface. */
@Value
public class PositionSnapshot {
    String instrument;
    PositionSide side;
    BigDecimal entryPrice;
    BigDecimal size;
    Instant cooldownUntil;
    Instant reconciledAt;
}
