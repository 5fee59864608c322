package com.signalrelay.backend.service.protection;

import com.signalrelay.backend.model.ConditionalOrderKind;
import com.signalrelay.backend.model.OrderResult;
import com.signalrelay.backend.model.SignalSide;
import com.signalrelay.backend.model.TriggerDirection;
import com.signalrelay.backend.service.gateway.ExchangeGateway;
import com.signalrelay.backend.service.gateway.GatewayCallGuard;
import com.signalrelay.backend.service.gateway.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Places take-profit and stop-loss orders for a freshly filled entry. Each order is attempted
 * independently; a failure is reported as an advisory and never aborts the other.
 */
@Service
public class ProtectiveOrderService {

    private static final Logger logger = LoggerFactory.getLogger(ProtectiveOrderService.class);

    private final ExchangeGateway exchangeGateway;
    private final GatewayCallGuard callGuard;
    private final ProtectiveOrderPlanner planner;

    public ProtectiveOrderService(ExchangeGateway exchangeGateway,
                                  GatewayCallGuard callGuard,
                                  ProtectiveOrderPlanner planner) {
        this.exchangeGateway = exchangeGateway;
        this.callGuard = callGuard;
        this.planner = planner;
    }

    /**
     * @param currentPrice market reference used to pick the stop trigger direction
     * @param simulated    when true nothing is sent to the venue
     */
    public ProtectiveOrderOutcome place(String instrument,
                                        SignalSide positionSide,
                                        long contracts,
                                        ProtectiveTargets targets,
                                        BigDecimal currentPrice,
                                        boolean simulated) {
        ProtectiveOrderOutcome.ProtectiveOrderOutcomeBuilder outcome = ProtectiveOrderOutcome.builder();

        if (targets.getTakeProfit() != null) {
            BigDecimal price = targets.getTakeProfit();
            outcome.takeProfitPrice(price);
            try {
                String orderId;
                if (simulated) {
                    orderId = simulatedId("TP");
                } else {
                    TriggerDirection direction = planner.triggerDirection(price, currentPrice, positionSide.opposite());
                    OrderResult result = callGuard.call("takeProfit " + instrument, () -> exchangeGateway.createConditionalOrder(
                            instrument, ConditionalOrderKind.TAKE_PROFIT, positionSide, contracts, price, direction, true));
                    orderId = result.getOrderId();
                }
                outcome.takeProfitOrderId(orderId);
                logger.info("Take-profit for {} {} x{} at {}: {}", instrument, positionSide, contracts, price, orderId);
            } catch (GatewayException e) {
                logger.warn("Take-profit for {} at {} failed: {}", instrument, price, e.getMessage());
                outcome.advisory("take_profit_failed: " + e.getMessage());
            }
        }

        if (targets.getStopLoss() != null) {
            BigDecimal price = targets.getStopLoss();
            outcome.stopLossPrice(price);
            TriggerDirection direction = planner.triggerDirection(price, currentPrice, positionSide);
            if (isBreached(direction, positionSide)) {
                logger.warn("Stop-loss for {} {} at {} is already on the wrong side of {}; trigger set {}",
                        instrument, positionSide, price, currentPrice, direction);
            }
            try {
                String orderId;
                if (simulated) {
                    orderId = simulatedId("SL");
                } else {
                    OrderResult result = callGuard.call("stopLoss " + instrument, () -> exchangeGateway.createConditionalOrder(
                            instrument, ConditionalOrderKind.STOP_LOSS, positionSide, contracts, price, direction, true));
                    orderId = result.getOrderId();
                }
                outcome.stopLossOrderId(orderId);
                logger.info("Stop-loss for {} {} x{} at {} ({}): {}", instrument, positionSide, contracts, price, direction, orderId);
            } catch (GatewayException e) {
                logger.warn("Stop-loss for {} at {} failed: {}", instrument, price, e.getMessage());
                outcome.advisory("stop_loss_failed: " + e.getMessage());
            }
        }

        return outcome.build();
    }

    private static boolean isBreached(TriggerDirection direction, SignalSide positionSide) {
        return positionSide == SignalSide.LONG ? direction == TriggerDirection.ASCENDING
                : direction == TriggerDirection.DESCENDING;
    }

    private static String simulatedId(String prefix) {
        return "DRY-" + prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
