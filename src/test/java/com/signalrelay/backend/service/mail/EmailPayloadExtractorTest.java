package com.signalrelay.backend.service.mail;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalrelay.backend.model.SignalPayload;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EmailPayloadExtractorTest {

    private final EmailPayloadExtractor extractor = new EmailPayloadExtractor(new ObjectMapper());

    @Test
    void extract_shouldFindJsonLineInBody() {
        String body = "TradingView alert fired\n"
                + "{\"side\":\"long\",\"symbol_tv\":\"MEXC:ETHUSDT.P\",\"bar_ts\":\"2024-05-03T11:45:00Z\",\"tp_pct\":2}\n"
                + "-- \nSent by TradingView";

        SignalPayload payload = extractor.extract("Alert: ETHUSDT", body).orElseThrow();

        assertEquals("long", payload.getSide());
        assertEquals("MEXC:ETHUSDT.P", payload.getSymbol());
        assertEquals("2024-05-03T11:45:00Z", payload.getBarTs());
        assertEquals(0, new BigDecimal("2").compareTo(payload.getTpPct()));
    }

    @Test
    void extract_shouldPreferSubject() {
        String subject = "{\"side\":\"short\",\"symbol\":\"BTCUSDT\",\"time\":\"1714736700\"}";
        String body = "{\"side\":\"long\",\"symbol\":\"ETHUSDT\",\"time\":\"1714736700\"}";

        SignalPayload payload = extractor.extract(subject, body).orElseThrow();

        assertEquals("short", payload.getSide());
        assertEquals("BTCUSDT", payload.getSymbol());
    }

    @Test
    void extract_shouldSpanMultiLineObject() {
        String body = "Alert:\n{\n  \"side\": \"short\",\n  \"symbol\": \"SOLUSDT\",\n  \"time_unix_ms\": 1714736700000\n}\nthanks";

        SignalPayload payload = extractor.extract(null, body).orElseThrow();

        assertEquals("SOLUSDT", payload.getSymbol());
        assertEquals("1714736700000", payload.getTimeUnixMs());
    }

    @Test
    void extract_shouldRepairCurlyQuotesAndSemicolons() {
        String body = "{“side”: “long”; “symbol”: “XRPUSDT”; “bar_ts”: “2024-05-03T11:45:00Z”}";

        SignalPayload payload = extractor.extract("", body).orElseThrow();

        assertEquals("long", payload.getSide());
        assertEquals("XRPUSDT", payload.getSymbol());
    }

    @Test
    void extract_shouldAcceptPythonDictLiteral() {
        String body = "{'side': 'short', 'symbol': 'ETHUSDT', 'bar_ts': '2024-05-03T11:45:00Z', 'sl': None, 'timeframe': '15'}";

        SignalPayload payload = extractor.extract("", body).orElseThrow();

        assertEquals("short", payload.getSide());
        assertEquals("15", payload.getTimeframe());
        assertNull(payload.getSl());
    }

    @Test
    void extract_withoutPayload_shouldBeEmpty() {
        assertTrue(extractor.extract("Weekly digest", "Nothing to see here").isEmpty());
        assertTrue(extractor.extract(null, "{not json at all}").isEmpty());
        Optional<SignalPayload> unrelated = extractor.extract(null, "{\"greeting\":\"hello\"}");
        assertTrue(unrelated.isEmpty());
    }
}
