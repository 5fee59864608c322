package com.signalrelay.backend.service.signal;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.MarginMode;
import com.signalrelay.backend.model.ProcessedSignal;
import com.signalrelay.backend.model.RejectionReason;
import com.signalrelay.backend.model.Signal;
import com.signalrelay.backend.model.SignalPayload;
import com.signalrelay.backend.model.SignalSide;
import com.signalrelay.backend.model.SignalSource;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Turns a raw transport payload into a {@link Signal}, or rejects it as invalid or stale.
 * This is the only place that knows about the loose input formats.
 */
@Component
public class SignalNormalizer {

    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final BigDecimal MILLIS_THRESHOLD = new BigDecimal("1000000000000");
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final Duration staleAfter;
    private final Clock clock;

    public SignalNormalizer(TradingProperties tradingProperties, Clock clock) {
        this.staleAfter = tradingProperties.getStaleAfter();
        this.clock = clock;
    }

    public Signal normalize(SignalPayload payload, SignalSource source) {
        if (payload == null) {
            throw invalid("empty payload");
        }

        SignalSide side = SignalSide.parse(payload.getSide());
        if (side == null) {
            throw invalid("side must be long or short, got '" + payload.getSide() + "'");
        }

        String instrument = trimToNull(payload.getSymbol());
        if (instrument == null) {
            throw invalid("symbol is required");
        }
        if (instrument.length() > ProcessedSignal.INSTRUMENT_LENGTH) {
            throw invalid("symbol longer than " + ProcessedSignal.INSTRUMENT_LENGTH + " characters");
        }

        String rawTime = firstPresent(payload.getTimeUnixMs(), payload.getBarTs(), payload.getTime());
        if (rawTime == null) {
            throw invalid("bar time is required (time_unix_ms, bar_ts or time)");
        }
        Instant barTime = parseBarTime(rawTime);
        if (barTime == null) {
            throw invalid("unparseable bar time '" + rawTime + "'");
        }

        if (payload.getNotional() != null && payload.getNotional().signum() <= 0) {
            throw invalid("notional must be positive");
        }
        if (payload.getLeverage() != null && payload.getLeverage() <= 0) {
            throw invalid("leverage must be positive");
        }
        String marginMode = trimToNull(payload.getMarginMode());
        if (marginMode != null && MarginMode.parse(marginMode) == null) {
            throw invalid("unsupported margin_mode '" + marginMode + "'");
        }

        String timeframe = trimToNull(payload.getTimeframe());
        if (timeframe != null && timeframe.length() > ProcessedSignal.TIMEFRAME_LENGTH) {
            throw invalid("timeframe longer than " + ProcessedSignal.TIMEFRAME_LENGTH + " characters");
        }

        Instant now = clock.instant();
        if (isStale(barTime, now)) {
            throw new SignalRejectedException(RejectionReason.STALE_SIGNAL,
                    "bar " + barTime + " is older than " + staleAfter.toHours() + "h");
        }

        return Signal.builder()
                .side(side)
                .instrument(instrument)
                .barTime(barTime)
                .timeframe(timeframe != null ? timeframe : Signal.UNKNOWN_TIMEFRAME)
                .source(source)
                .notional(payload.getNotional())
                .leverage(payload.getLeverage())
                .marginMode(marginMode)
                .takeProfit(payload.getTp())
                .stopLoss(payload.getSl())
                .takeProfitPct(payload.getTpPct())
                .stopLossPct(payload.getSlPct())
                .secret(payload.getSecret())
                .build();
    }

    public boolean isStale(Instant barTime, Instant now) {
        return Duration.between(barTime, now).compareTo(staleAfter) > 0;
    }

    /**
     * Accepts ISO-8601 with an offset or {@code Z}, zone-less ISO-8601 (read as UTC), and
     * numeric epoch seconds or milliseconds. Numbers above 1e12 are milliseconds.
     *
     * @return the instant, or null when the text matches none of those forms
     */
    public static Instant parseBarTime(String raw) {
        String text = trimToNull(raw);
        if (text == null) {
            return null;
        }

        if (NUMERIC.matcher(text).matches()) {
            BigDecimal value = new BigDecimal(text);
            if (value.signum() <= 0) {
                return null;
            }
            BigDecimal millis = value.compareTo(MILLIS_THRESHOLD) > 0 ? value : value.multiply(THOUSAND);
            try {
                return Instant.ofEpochMilli(millis.setScale(0, RoundingMode.DOWN).longValueExact());
            } catch (ArithmeticException e) {
                return null;
            }
        }

        String iso = text.indexOf('T') < 0 ? text.replaceFirst(" ", "T") : text;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(iso, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String firstPresent(String... values) {
        for (String value : values) {
            String trimmed = trimToNull(value);
            if (trimmed != null) {
                return trimmed;
            }
        }
        return null;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static SignalRejectedException invalid(String message) {
        return new SignalRejectedException(RejectionReason.INVALID_SIGNAL, message);
    }
}
