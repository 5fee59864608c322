package com.signalrelay.backend.service.position;

import com.signalrelay.backend.model.ExchangePosition;
import com.signalrelay.backend.model.PositionRecord;
import com.signalrelay.backend.model.PositionSide;
import com.signalrelay.backend.model.PositionSnapshot;
import com.signalrelay.backend.model.SignalSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Per-instrument position cache with one lock per instrument. A read-through view of the
 * venue: records are refreshed from the venue before each decision, and only the cooldown
 * is local state.
 */
@Component
public class PositionBook {

    private static final Logger logger = LoggerFactory.getLogger(PositionBook.class);

    private final Map<String, PositionRecord> records = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Waits at most {@code timeout} for exclusive access to an instrument.
     * @return true if the lock was acquired; the caller must then {@link #unlock(String)}
     */
    public boolean tryLock(String instrument, Duration timeout) throws InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent(instrument, key -> new ReentrantLock(true));
        return lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void unlock(String instrument) {
        ReentrantLock lock = locks.get(instrument);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    /** Lazily creates the record. */
    public PositionRecord get(String instrument) {
        return records.computeIfAbsent(instrument, PositionRecord::new);
    }

    /**
     * Overwrites side, size and entry with what the venue reports for {@code instrument}.
     * An instrument absent from {@code venuePositions} is flat.
     */
    public PositionRecord reconcile(String instrument, List<ExchangePosition> venuePositions, Instant now) {
        PositionRecord record = get(instrument);
        PositionSide before = record.getSide();
        BigDecimal sizeBefore = record.getSize();

        BigDecimal signedSize = BigDecimal.ZERO;
        BigDecimal entryPrice = null;
        for (ExchangePosition position : venuePositions) {
            if (instrument.equalsIgnoreCase(position.getInstrument()) && position.getSignedSize() != null) {
                signedSize = signedSize.add(position.getSignedSize());
                if (position.getEntryPrice() != null) {
                    entryPrice = position.getEntryPrice();
                }
            }
        }

        record.applyExchangeState(PositionSide.fromSignedSize(signedSize), signedSize.abs(), entryPrice, now);

        if (before != record.getSide() || sizeBefore.compareTo(record.getSize()) != 0) {
            logger.info("Reconciled {}: cached {} x{} -> venue {} x{}",
                    instrument, before, sizeBefore.toPlainString(), record.getSide(), record.getSize().toPlainString());
        }
        return record;
    }

    /**
     * Records a filled entry and arms the cooldown.
     */
    public PositionRecord recordFill(String instrument, SignalSide side, BigDecimal entryPrice, long contracts,
                                     Instant now, Instant cooldownUntil) {
        PositionRecord record = get(instrument);
        record.applyExchangeState(side.toPositionSide(), BigDecimal.valueOf(contracts), entryPrice, now);
        record.armCooldown(cooldownUntil);
        return record;
    }

    public List<PositionSnapshot> snapshot() {
        return records.values().stream()
                .map(PositionRecord::snapshot)
                .sorted(Comparator.comparing(PositionSnapshot::getInstrument))
                .collect(Collectors.toList());
    }
}
