package com.signalrelay.backend.service.protection;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Resolved take-profit and stop-loss prices. Either may be null when disabled.
 */
@Value
public class ProtectiveTargets {
    BigDecimal takeProfit;
    BigDecimal stopLoss;

    public boolean isEmpty() {
        return takeProfit == null && stopLoss == null;
    }
}
