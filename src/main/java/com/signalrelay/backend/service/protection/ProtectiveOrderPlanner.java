package com.signalrelay.backend.service.protection;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.Signal;
import com.signalrelay.backend.model.SignalSide;
import com.signalrelay.backend.model.TriggerDirection;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Pure price logic for protective orders: target resolution and stop trigger direction.
 */
@Component
public class ProtectiveOrderPlanner {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal defaultTakeProfitPct;
    private final BigDecimal defaultStopLossPct;

    public ProtectiveOrderPlanner(TradingProperties tradingProperties) {
        this.defaultTakeProfitPct = tradingProperties.getTakeProfitPct();
        this.defaultStopLossPct = tradingProperties.getStopLossPct();
    }

    /**
     * Resolves targets for a position opened at {@code entryPrice}.
     * Priority per target: absolute price in the signal, then percentage in the signal,
     * then the configured percentage. A configured percentage of zero disables the target.
     * Percentages are in percent (2.5 means 2.5%) and point away from entry: TP above and
     * SL below for LONG, inverted for SHORT.
     *
     * @param priceUnit tick size to round to, or null to leave prices unrounded
     */
    public ProtectiveTargets resolveTargets(SignalSide side, BigDecimal entryPrice, Signal signal, BigDecimal priceUnit) {
        BigDecimal takeProfit = resolve(signal.getTakeProfit(), signal.getTakeProfitPct(), defaultTakeProfitPct,
                entryPrice, side == SignalSide.LONG);
        BigDecimal stopLoss = resolve(signal.getStopLoss(), signal.getStopLossPct(), defaultStopLossPct,
                entryPrice, side == SignalSide.SHORT);
        return new ProtectiveTargets(roundToUnit(takeProfit, priceUnit), roundToUnit(stopLoss, priceUnit));
    }

    /**
     * Direction the market has to move for a stop at {@code stopPrice} to fire, judged against
     * the current price rather than the position side. A stop equal to the current price falls
     * back to the side: a LONG is protected against a decline, a SHORT against a rise.
     */
    public TriggerDirection triggerDirection(BigDecimal stopPrice, BigDecimal currentPrice, SignalSide positionSide) {
        int cmp = stopPrice.compareTo(currentPrice);
        if (cmp < 0) {
            return TriggerDirection.DESCENDING;
        }
        if (cmp > 0) {
            return TriggerDirection.ASCENDING;
        }
        return positionSide == SignalSide.LONG ? TriggerDirection.DESCENDING : TriggerDirection.ASCENDING;
    }

    static BigDecimal roundToUnit(BigDecimal price, BigDecimal priceUnit) {
        if (price == null || priceUnit == null || priceUnit.signum() <= 0) {
            return price;
        }
        BigDecimal ticks = price.divide(priceUnit, 0, RoundingMode.HALF_UP);
        return ticks.multiply(priceUnit).stripTrailingZeros();
    }

    private static BigDecimal resolve(BigDecimal absolute, BigDecimal signalPct, BigDecimal configuredPct,
                                      BigDecimal entryPrice, boolean above) {
        if (absolute != null && absolute.signum() > 0) {
            return absolute;
        }
        BigDecimal pct = signalPct != null && signalPct.signum() > 0 ? signalPct : configuredPct;
        if (pct == null || pct.signum() <= 0 || entryPrice == null) {
            return null;
        }
        BigDecimal offset = pct.divide(HUNDRED, MathContext.DECIMAL64);
        BigDecimal factor = above ? BigDecimal.ONE.add(offset) : BigDecimal.ONE.subtract(offset);
        if (factor.signum() <= 0) {
            return null;
        }
        return entryPrice.multiply(factor, MathContext.DECIMAL64);
    }
}
