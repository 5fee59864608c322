package com.signalrelay.backend.service.mail;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.signalrelay.backend.model.SignalPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the alert JSON in an email subject or body. Alert emails are hand-templated, so the
 * object is parsed strictly first and then through a lenient repair path.
 */
@Component
public class EmailPayloadExtractor {

    private static final Logger logger = LoggerFactory.getLogger(EmailPayloadExtractor.class);

    private static final Pattern PY_TRUE = Pattern.compile("\\bTrue\\b");
    private static final Pattern PY_FALSE = Pattern.compile("\\bFalse\\b");
    private static final Pattern PY_NONE = Pattern.compile("\\bNone\\b");

    private final ObjectReader strictReader;
    private final ObjectReader lenientReader;

    public EmailPayloadExtractor(ObjectMapper objectMapper) {
        this.strictReader = objectMapper.readerFor(SignalPayload.class);
        this.lenientReader = strictReader
                .with(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature())
                .with(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
                .with(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES.mappedFeature())
                .with(JsonParser.Feature.ALLOW_COMMENTS);
    }

    /**
     * Subject first, then body.
     */
    public Optional<SignalPayload> extract(String subject, String body) {
        Optional<SignalPayload> fromSubject = extractFrom(subject);
        if (fromSubject.isPresent()) {
            return fromSubject;
        }
        return extractFrom(body);
    }

    Optional<SignalPayload> extractFrom(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String candidate = findJsonObject(normalizeQuotes(text));
        if (candidate == null) {
            return Optional.empty();
        }

        SignalPayload payload = parse(strictReader, candidate);
        if (payload == null) {
            payload = parse(lenientReader, repair(candidate));
        }
        if (payload == null || (payload.getSide() == null && payload.getSymbol() == null)) {
            logger.debug("No alert payload in candidate {}", candidate);
            return Optional.empty();
        }
        return Optional.of(payload);
    }

    /**
     * A line that is itself a {@code {...}} object wins; otherwise the span from the first
     * opening to the last closing brace.
     */
    static String findJsonObject(String text) {
        for (String line : text.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
                return trimmed;
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        return null;
    }

    static String normalizeQuotes(String text) {
        return text
                .replace('“', '"')
                .replace('”', '"')
                .replace('„', '"')
                .replace('″', '"')
                .replace('‘', '\'')
                .replace('’', '\'')
                .replace(' ', ' ');
    }

    /**
     * Semicolons used as separators and Python dict literals.
     */
    static String repair(String candidate) {
        String repaired = candidate.replace(';', ',');
        repaired = PY_TRUE.matcher(repaired).replaceAll("true");
        repaired = PY_FALSE.matcher(repaired).replaceAll("false");
        return PY_NONE.matcher(repaired).replaceAll("null");
    }

    private static SignalPayload parse(ObjectReader reader, String json) {
        try {
            return reader.readValue(json);
        } catch (JsonProcessingException e) {
            logger.debug("Payload parse failed: {}", e.getOriginalMessage());
            return null;
        }
    }
}
