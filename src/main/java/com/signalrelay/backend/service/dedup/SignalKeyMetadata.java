package com.signalrelay.backend.service.dedup;

import com.signalrelay.backend.model.Signal;
import lombok.Value;

/**
 * Components of a dedup key. Two deliveries with equal components are the same logical
 * signal, whichever transport they came through.
 */
@Value
public class SignalKeyMetadata {
    String venue;
    String instrument;
    String side;
    String timeframe;
    long barTimeMs;

    public static SignalKeyMetadata of(String venue, Signal signal) {
        return new SignalKeyMetadata(
                venue,
                signal.getInstrument(),
                signal.getSide().wireName(),
                signal.getTimeframe(),
                signal.barTimeMillis());
    }

    public String toKey() {
        return String.join("|", venue, instrument, side, timeframe, Long.toString(barTimeMs));
    }
}
