package com.signalrelay.backend.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Contract specification of a venue instrument. Any field may be null when the venue
 * omits it.
 */
@Value
@Builder
public class InstrumentMetadata {
    String instrument;
    /** Base-asset amount represented by one contract. */
    BigDecimal contractSize;
    /** Smallest order volume in contracts. */
    Long minContracts;
    /** Price tick. */
    BigDecimal priceUnit;
    Integer maxLeverage;
}
