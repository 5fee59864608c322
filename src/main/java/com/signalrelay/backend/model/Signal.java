package com.signalrelay.backend.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One normalized trading instruction derived from a closed chart bar.
 */
@Value
@Builder
public class Signal {
    public static final String UNKNOWN_TIMEFRAME = "unknown";

    SignalSide side;
    /** Symbol exactly as received from the transport, trimmed. */
    String instrument;
    Instant barTime;
    String timeframe;
    SignalSource source;

    BigDecimal notional;
    Integer leverage;
    String marginMode;

    BigDecimal takeProfit;
    BigDecimal stopLoss;
    BigDecimal takeProfitPct;
    BigDecimal stopLossPct;

    @ToString.Exclude
    String secret;

    public long barTimeMillis() {
        return barTime.toEpochMilli();
    }
}
