package com.signalrelay.backend.service;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.ExchangePosition;
import com.signalrelay.backend.model.ExecutionResult;
import com.signalrelay.backend.model.InstrumentMetadata;
import com.signalrelay.backend.model.MarginMode;
import com.signalrelay.backend.model.OrderResult;
import com.signalrelay.backend.model.PositionRecord;
import com.signalrelay.backend.model.PositionSide;
import com.signalrelay.backend.model.RejectionReason;
import com.signalrelay.backend.model.Signal;
import com.signalrelay.backend.model.SignalPayload;
import com.signalrelay.backend.model.SignalSide;
import com.signalrelay.backend.model.SignalSource;
import com.signalrelay.backend.service.dedup.DedupStore;
import com.signalrelay.backend.service.dedup.SignalKeyMetadata;
import com.signalrelay.backend.service.gateway.ExchangeGateway;
import com.signalrelay.backend.service.gateway.GatewayCallGuard;
import com.signalrelay.backend.service.gateway.GatewayException;
import com.signalrelay.backend.service.position.PositionBook;
import com.signalrelay.backend.service.position.PositionStateMachine;
import com.signalrelay.backend.service.position.TransitionDecision;
import com.signalrelay.backend.service.protection.ProtectiveOrderOutcome;
import com.signalrelay.backend.service.protection.ProtectiveOrderPlanner;
import com.signalrelay.backend.service.protection.ProtectiveOrderService;
import com.signalrelay.backend.service.protection.ProtectiveTargets;
import com.signalrelay.backend.service.signal.SignalNormalizer;
import com.signalrelay.backend.service.signal.SignalRejectedException;
import com.signalrelay.backend.service.sizing.PositionSizingCalculator;
import com.signalrelay.backend.service.util.SignatureUtil;
import com.signalrelay.backend.service.util.SymbolMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point shared by every transport: turns one signal into at most one entry order.
 *
 * <p>Executions for the same venue instrument are serialized by the {@link PositionBook} lock;
 * the dedup lookup is repeated under that lock so that check-then-mark is atomic per key.
 * Every outcome is returned as an {@link ExecutionResult}; nothing is thrown to the caller.
 */
@Service
public class SignalExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(SignalExecutionEngine.class);

    private final TradingProperties tradingProperties;
    private final SignalNormalizer signalNormalizer;
    private final DedupStore dedupStore;
    private final SymbolMapper symbolMapper;
    private final ExchangeGateway exchangeGateway;
    private final GatewayCallGuard callGuard;
    private final PositionBook positionBook;
    private final PositionStateMachine stateMachine;
    private final PositionSizingCalculator sizingCalculator;
    private final ProtectiveOrderPlanner protectiveOrderPlanner;
    private final ProtectiveOrderService protectiveOrderService;
    private final Clock clock;

    public SignalExecutionEngine(TradingProperties tradingProperties,
                                 SignalNormalizer signalNormalizer,
                                 DedupStore dedupStore,
                                 SymbolMapper symbolMapper,
                                 ExchangeGateway exchangeGateway,
                                 GatewayCallGuard callGuard,
                                 PositionBook positionBook,
                                 PositionStateMachine stateMachine,
                                 PositionSizingCalculator sizingCalculator,
                                 ProtectiveOrderPlanner protectiveOrderPlanner,
                                 ProtectiveOrderService protectiveOrderService,
                                 Clock clock) {
        this.tradingProperties = tradingProperties;
        this.signalNormalizer = signalNormalizer;
        this.dedupStore = dedupStore;
        this.symbolMapper = symbolMapper;
        this.exchangeGateway = exchangeGateway;
        this.callGuard = callGuard;
        this.positionBook = positionBook;
        this.stateMachine = stateMachine;
        this.sizingCalculator = sizingCalculator;
        this.protectiveOrderPlanner = protectiveOrderPlanner;
        this.protectiveOrderService = protectiveOrderService;
        this.clock = clock;
    }

    public ExecutionResult execute(SignalPayload payload, SignalSource source) {
        try {
            ExecutionResult result = doExecute(payload, source);
            logResult(result, source);
            return result;
        } catch (RuntimeException e) {
            logger.error("Unexpected failure executing {} signal {}", source, payload, e);
            return ExecutionResult.error("internal error: " + e.getMessage(), true);
        }
    }

    private ExecutionResult doExecute(SignalPayload payload, SignalSource source) {
        if (!tradingProperties.isEnabled()) {
            return ExecutionResult.rejected(RejectionReason.TRADING_DISABLED, "trading is disabled");
        }

        Signal signal;
        try {
            signal = signalNormalizer.normalize(payload, source);
        } catch (SignalRejectedException e) {
            return ExecutionResult.rejected(e.getReason(), e.getMessage());
        }

        if (!isAuthorized(signal)) {
            return ExecutionResult.rejected(RejectionReason.UNAUTHORIZED, "secret mismatch");
        }

        SignalKeyMetadata keyMetadata = SignalKeyMetadata.of(tradingProperties.getVenue(), signal);
        String dedupKey = keyMetadata.toKey();
        try {
            if (dedupStore.isProcessed(dedupKey)) {
                return duplicate(dedupKey, signal);
            }
        } catch (DataAccessException e) {
            logger.error("Dedup lookup failed for {}", dedupKey, e);
            return withKey(ExecutionResult.error("dedup store unavailable: " + e.getMessage(), true), dedupKey);
        }

        Optional<String> mapped = symbolMapper.toVenueSymbol(signal.getInstrument());
        if (mapped.isEmpty()) {
            return withKey(ExecutionResult.rejected(RejectionReason.INVALID_SIGNAL,
                    "cannot map symbol '" + signal.getInstrument() + "' to a venue instrument"), dedupKey);
        }
        String instrument = mapped.get();

        boolean locked;
        try {
            locked = positionBook.tryLock(instrument, tradingProperties.getLockWaitTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return withKey(ExecutionResult.error("interrupted while waiting for " + instrument, true), dedupKey);
        }
        if (!locked) {
            logger.warn("Could not lock {} within {} ms", instrument, tradingProperties.getLockWaitTimeout().toMillis());
            return withKey(ExecutionResult.error(instrument + " is busy, retry later", true), dedupKey);
        }

        try {
            return executeLocked(signal, instrument, keyMetadata, dedupKey);
        } finally {
            positionBook.unlock(instrument);
        }
    }

    private ExecutionResult executeLocked(Signal signal, String instrument, SignalKeyMetadata keyMetadata, String dedupKey) {
        // a concurrent delivery of the same key may have finished while we waited
        try {
            if (dedupStore.isProcessed(dedupKey)) {
                return duplicate(dedupKey, signal);
            }
        } catch (DataAccessException e) {
            logger.error("Dedup lookup failed for {}", dedupKey, e);
            return withKey(ExecutionResult.error("dedup store unavailable: " + e.getMessage(), true), dedupKey);
        }

        boolean dryRun = tradingProperties.isDryRun();
        SignalSide side = signal.getSide();
        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .dedupKey(dedupKey)
                .instrument(instrument)
                .side(side)
                .simulated(dryRun);

        if (!dryRun) {
            applyLeverageAndMargin(signal, instrument, result);
        }

        BigDecimal lastPrice;
        try {
            lastPrice = callGuard.call("getLastPrice " + instrument, () -> exchangeGateway.getLastPrice(instrument));
        } catch (GatewayException e) {
            logger.warn("Price fetch for {} failed: {}", instrument, e.getMessage());
            return withKey(ExecutionResult.error("price fetch failed: " + e.getMessage(), e.isRetryable()), dedupKey);
        }

        InstrumentMetadata metadata = fetchMetadata(instrument);

        Instant now = clock.instant();
        PositionRecord record;
        if (dryRun) {
            record = positionBook.get(instrument);
        } else {
            try {
                List<ExchangePosition> positions = callGuard.call("listPositions " + instrument,
                        () -> exchangeGateway.listPositions(instrument));
                record = positionBook.reconcile(instrument, positions, now);
            } catch (GatewayException e) {
                logger.warn("Position reconciliation for {} failed: {}", instrument, e.getMessage());
                return withKey(ExecutionResult.error("position fetch failed: " + e.getMessage(), e.isRetryable()), dedupKey);
            }
        }

        PositionSide current = record.getSide();
        TransitionDecision decision = stateMachine.decide(record, side, now);
        switch (decision) {
            case ALREADY_IN_POSITION:
                return withKey(ExecutionResult.rejected(RejectionReason.ALREADY_IN_POSITION,
                        "already " + current + " " + record.getSize().toPlainString() + " on " + instrument), dedupKey);
            case COOLDOWN:
                return withKey(ExecutionResult.rejected(RejectionReason.COOLDOWN,
                        instrument + " in cooldown until " + record.getCooldownUntil()), dedupKey);
            case FLIP:
                result.flippedFrom(current);
                closeForFlip(instrument, current, record.getSize(), dryRun, result);
                break;
            default:
                break;
        }

        BigDecimal notional = signal.getNotional() != null ? signal.getNotional() : tradingProperties.getDefaultNotional();
        long contracts;
        try {
            contracts = sizingCalculator.contractsFor(instrument, notional, lastPrice, metadata);
        } catch (IllegalArgumentException e) {
            return withKey(ExecutionResult.error("sizing failed: " + e.getMessage(), false), dedupKey);
        }

        OrderResult entry;
        if (dryRun) {
            entry = new OrderResult("DRY-" + UUID.randomUUID().toString().substring(0, 8), lastPrice);
            logger.info("[DRY RUN] {} {} x{} at {} (notional {})", side, instrument, contracts, lastPrice, notional);
        } else {
            try {
                entry = callGuard.call("entry " + instrument,
                        () -> exchangeGateway.createMarketOrder(instrument, side, contracts, false));
            } catch (GatewayException e) {
                return entryFailed(e, keyMetadata, dedupKey, result);
            }
        }

        // The entry order is irrevocable from here on: bookkeeping and protection run to completion
        // and a pending interrupt is re-raised afterwards.
        boolean interrupted = Thread.interrupted();
        try {
            BigDecimal entryPrice = entry.getFillPrice() != null ? entry.getFillPrice() : lastPrice;
            positionBook.recordFill(instrument, side, entryPrice, contracts, now,
                    now.plusSeconds(tradingProperties.getCooldownSeconds()));
            result.status(ExecutionResult.Status.FILLED)
                    .orderId(entry.getOrderId())
                    .contracts(contracts)
                    .fillPrice(entryPrice);
            markProcessed(dedupKey, keyMetadata, dryRun ? "simulated_ok" : "ok", result);

            ProtectiveTargets targets = protectiveOrderPlanner.resolveTargets(side, entryPrice, signal,
                    metadata != null ? metadata.getPriceUnit() : null);
            if (!targets.isEmpty()) {
                ProtectiveOrderOutcome protection = protectiveOrderService.place(
                        instrument, side, contracts, targets, entryPrice, dryRun);
                result.takeProfitOrderId(protection.getTakeProfitOrderId())
                        .takeProfitPrice(protection.getTakeProfitPrice())
                        .stopLossOrderId(protection.getStopLossOrderId())
                        .stopLossPrice(protection.getStopLossPrice())
                        .advisories(protection.getAdvisories());
            }
            return result.build();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private boolean isAuthorized(Signal signal) {
        if (!tradingProperties.hasWebhookSecret()) {
            return true;
        }
        String provided = signal.getSecret();
        switch (signal.getSource()) {
            case WEBHOOK:
                return SignatureUtil.secretsMatch(tradingProperties.getWebhookSecret(), provided);
            case EMAIL:
                return provided == null || SignatureUtil.secretsMatch(tradingProperties.getWebhookSecret(), provided);
            default:
                return false;
        }
    }

    /**
     * Best effort: leverage may already be set correctly on the venue.
     */
    private void applyLeverageAndMargin(Signal signal, String instrument, ExecutionResult.ExecutionResultBuilder result) {
        String modeName = signal.getMarginMode() != null ? signal.getMarginMode() : tradingProperties.getDefaultMarginMode();
        MarginMode mode = MarginMode.parse(modeName);
        if (mode != null) {
            try {
                callGuard.run("setMarginMode " + instrument, () -> exchangeGateway.setMarginMode(instrument, mode));
            } catch (GatewayException e) {
                logger.warn("Setting margin mode {} on {} failed: {}", mode, instrument, e.getMessage());
                result.advisory("margin_mode_failed: " + e.getMessage());
            }
        }

        int leverage = signal.getLeverage() != null ? signal.getLeverage() : tradingProperties.getDefaultLeverage();
        try {
            callGuard.run("setLeverage " + instrument, () -> exchangeGateway.setLeverage(instrument, leverage));
        } catch (GatewayException e) {
            logger.warn("Setting leverage {}x on {} failed: {}", leverage, instrument, e.getMessage());
            result.advisory("leverage_failed: " + e.getMessage());
        }
    }

    private InstrumentMetadata fetchMetadata(String instrument) {
        try {
            return callGuard.call("instrumentMetadata " + instrument, () -> exchangeGateway.instrumentMetadata(instrument));
        } catch (GatewayException e) {
            logger.warn("No instrument metadata for {}, using fallback contract size: {}", instrument, e.getMessage());
            return null;
        }
    }

    /**
     * Best-effort close of the opposite side. A failed close does not block the new entry.
     */
    private void closeForFlip(String instrument, PositionSide current, BigDecimal size, boolean dryRun,
                              ExecutionResult.ExecutionResultBuilder result) {
        SignalSide closing = current == PositionSide.LONG ? SignalSide.LONG : SignalSide.SHORT;
        long closeContracts = size.setScale(0, RoundingMode.UP).longValue();
        if (dryRun) {
            logger.info("[DRY RUN] Closing {} {} x{} before flip", current, instrument, closeContracts);
            return;
        }
        try {
            OrderResult close = callGuard.call("closeForFlip " + instrument,
                    () -> exchangeGateway.createMarketOrder(instrument, closing, closeContracts, true));
            logger.info("Closed {} {} x{} before flip: {}", current, instrument, closeContracts, close.getOrderId());
        } catch (GatewayException e) {
            logger.warn("Closing {} {} x{} before flip failed: {}", current, instrument, closeContracts, e.getMessage());
            result.advisory("flip_close_failed: " + e.getMessage());
        }
    }

    /**
     * A definitive venue rejection finalizes the key so redeliveries cannot retry it; a
     * transient failure leaves it unmarked for the transport's own redelivery.
     */
    private ExecutionResult entryFailed(GatewayException e, SignalKeyMetadata keyMetadata, String dedupKey,
                                        ExecutionResult.ExecutionResultBuilder result) {
        if (e.isRetryable()) {
            logger.error("Entry order for {} failed transiently, leaving {} unmarked: {}",
                    keyMetadata.getInstrument(), dedupKey, e.getMessage());
            return result.status(ExecutionResult.Status.ERROR)
                    .detail("entry order failed: " + e.getMessage())
                    .retryable(true)
                    .build();
        }
        logger.error("Entry order for {} rejected by venue (code {}): {}",
                keyMetadata.getInstrument(), e.getVenueCode(), e.getMessage());
        result.status(ExecutionResult.Status.ERROR)
                .detail("entry order rejected: " + e.getMessage())
                .retryable(false);
        markProcessed(dedupKey, keyMetadata, "order_failed", result);
        return result.build();
    }

    private void markProcessed(String dedupKey, SignalKeyMetadata keyMetadata, String status,
                               ExecutionResult.ExecutionResultBuilder result) {
        try {
            dedupStore.markProcessed(dedupKey, keyMetadata, status);
        } catch (RuntimeException e) {
            logger.error("Could not write dedup record {} ({})", dedupKey, status, e);
            result.advisory("dedup_mark_failed: " + e.getMessage());
        }
    }

    private ExecutionResult duplicate(String dedupKey, Signal signal) {
        return withKey(ExecutionResult.rejected(RejectionReason.DUPLICATE_SIGNAL,
                "already processed " + signal.getSide().wireName() + " " + signal.getInstrument()
                        + " bar " + signal.getBarTime()), dedupKey);
    }

    private static ExecutionResult withKey(ExecutionResult result, String dedupKey) {
        return result.toBuilder().dedupKey(dedupKey).build();
    }

    private void logResult(ExecutionResult result, SignalSource source) {
        switch (result.getStatus()) {
            case FILLED:
                logger.info("{} signal filled: {} {} x{} at {} order={} flippedFrom={} advisories={}",
                        source, result.getSide(), result.getInstrument(), result.getContracts(), result.getFillPrice(),
                        result.getOrderId(), result.getFlippedFrom(), result.getAdvisories());
                break;
            case REJECTED:
                logger.info("{} signal rejected ({}): {}", source, result.getReason(), result.getDetail());
                break;
            default:
                logger.warn("{} signal failed (retryable={}): {}", source, result.isRetryable(), result.getDetail());
                break;
        }
    }
}
