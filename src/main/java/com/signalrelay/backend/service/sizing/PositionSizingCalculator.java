package com.signalrelay.backend.service.sizing;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.InstrumentMetadata;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Converts a quote-currency notional into a whole number of contracts.
 */
@Component
public class PositionSizingCalculator {

    private final Map<String, BigDecimal> fallbackContractSizes;
    private final BigDecimal defaultContractSize;

    public PositionSizingCalculator(TradingProperties tradingProperties) {
        this.fallbackContractSizes = tradingProperties.getContractSizes();
        this.defaultContractSize = tradingProperties.getDefaultContractSize();
    }

    /**
     * {@code floor(notional / (lastPrice * contractSize))}, never less than one contract.
     * Pure; monotonically non-decreasing in {@code notionalUsd}.
     */
    public static long contracts(BigDecimal notionalUsd, BigDecimal lastPrice, BigDecimal contractSize) {
        if (notionalUsd == null || lastPrice == null || contractSize == null) {
            throw new IllegalArgumentException("notional, price and contract size are required");
        }
        if (lastPrice.signum() <= 0 || contractSize.signum() <= 0) {
            throw new IllegalArgumentException("price and contract size must be positive");
        }
        if (notionalUsd.signum() <= 0) {
            return 1L;
        }
        BigDecimal raw = notionalUsd.divide(lastPrice.multiply(contractSize), 8, RoundingMode.DOWN);
        long floored;
        try {
            floored = raw.setScale(0, RoundingMode.FLOOR).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("order size out of range for notional " + notionalUsd.toPlainString(), e);
        }
        return Math.max(1L, floored);
    }

    /**
     * Contracts for an order on a venue instrument, raised to the venue's minimum volume if it
     * reports one.
     */
    public long contractsFor(String instrument, BigDecimal notionalUsd, BigDecimal lastPrice, InstrumentMetadata metadata) {
        long contracts = contracts(notionalUsd, lastPrice, resolveContractSize(instrument, metadata));
        if (metadata != null && metadata.getMinContracts() != null && metadata.getMinContracts() > contracts) {
            return metadata.getMinContracts();
        }
        return contracts;
    }

    /**
     * Venue metadata first, then the static table, then the configured default.
     */
    public BigDecimal resolveContractSize(String instrument, InstrumentMetadata metadata) {
        if (metadata != null && metadata.getContractSize() != null && metadata.getContractSize().signum() > 0) {
            return metadata.getContractSize();
        }
        BigDecimal fallback = fallbackContractSizes.get(instrument);
        if (fallback != null && fallback.signum() > 0) {
            return fallback;
        }
        return defaultContractSize;
    }
}
