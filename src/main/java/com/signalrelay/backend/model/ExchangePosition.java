package com.signalrelay.backend.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One open position as reported by the venue. Positive size is long, negative short.
 */
@Value
public class ExchangePosition {
    String instrument;
    BigDecimal signedSize;
    BigDecimal entryPrice;
}
