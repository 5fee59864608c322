package com.signalrelay.backend.service.gateway;

import com.signalrelay.backend.model.ConditionalOrderKind;
import com.signalrelay.backend.model.ExchangePosition;
import com.signalrelay.backend.model.InstrumentMetadata;
import com.signalrelay.backend.model.MarginMode;
import com.signalrelay.backend.model.OrderResult;
import com.signalrelay.backend.model.SignalSide;
import com.signalrelay.backend.model.TriggerDirection;

import java.math.BigDecimal;
import java.util.List;

/**
 * Trading venue operations used by the execution engine. Instruments are venue symbols.
 * Every method may throw {@link GatewayException}.
 */
public interface ExchangeGateway {

    BigDecimal getLastPrice(String instrument);

    void setLeverage(String instrument, int leverage);

    void setMarginMode(String instrument, MarginMode mode);

    /**
     * Market order. With {@code reduceOnly} the order can only shrink an existing position:
     * {@code side} is then the side of the position being closed.
     */
    OrderResult createMarketOrder(String instrument, SignalSide side, long contracts, boolean reduceOnly);

    /**
     * Protective order for an open position of {@code positionSide}.
     */
    OrderResult createConditionalOrder(String instrument,
                                       ConditionalOrderKind kind,
                                       SignalSide positionSide,
                                       long contracts,
                                       BigDecimal triggerPrice,
                                       TriggerDirection triggerDirection,
                                       boolean reduceOnly);

    /**
     * Open positions, optionally restricted to one instrument (null for all).
     */
    List<ExchangePosition> listPositions(String instrument);

    InstrumentMetadata instrumentMetadata(String instrument);
}
