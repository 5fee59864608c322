package com.signalrelay.backend.service.mail;

import com.signalrelay.backend.config.MailboxProperties;
import com.signalrelay.backend.model.ExecutionResult;
import com.signalrelay.backend.model.ProcessedEmail;
import com.signalrelay.backend.model.RejectionReason;
import com.signalrelay.backend.model.SignalPayload;
import com.signalrelay.backend.model.SignalSource;
import com.signalrelay.backend.repository.ProcessedEmailRepository;
import com.signalrelay.backend.service.SignalExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Email-level handling around the execution engine: Message-ID dedup, message age, payload
 * extraction. The bar-level dedup inside the engine still applies on top of this.
 */
@Service
public class EmailAlertProcessor {

    private static final Logger logger = LoggerFactory.getLogger(EmailAlertProcessor.class);

    static final String STATUS_STALE = "stale_message";
    static final String STATUS_INVALID = "invalid_payload";

    private final ProcessedEmailRepository processedEmailRepository;
    private final EmailPayloadExtractor payloadExtractor;
    private final SignalExecutionEngine executionEngine;
    private final Duration maxMessageAge;
    private final Clock clock;

    public EmailAlertProcessor(ProcessedEmailRepository processedEmailRepository,
                               EmailPayloadExtractor payloadExtractor,
                               SignalExecutionEngine executionEngine,
                               MailboxProperties mailboxProperties,
                               Clock clock) {
        this.processedEmailRepository = processedEmailRepository;
        this.payloadExtractor = payloadExtractor;
        this.executionEngine = executionEngine;
        this.maxMessageAge = mailboxProperties.getMaxMessageAge();
        this.clock = clock;
    }

    public EmailDisposition process(InboundEmail email) {
        String messageId = resolveMessageId(email);
        if (processedEmailRepository.existsById(messageId)) {
            logger.debug("Email {} already processed", messageId);
            return EmailDisposition.ALREADY_PROCESSED;
        }

        Instant now = clock.instant();
        if (email.getSentAt() != null && Duration.between(email.getSentAt(), now).compareTo(maxMessageAge) > 0) {
            logger.info("Skipping email {} sent at {}: older than {}", messageId, email.getSentAt(), maxMessageAge);
            record(messageId, null, STATUS_STALE, now);
            return EmailDisposition.STALE_MESSAGE;
        }

        Optional<SignalPayload> extracted = payloadExtractor.extract(email.getSubject(), email.getBody());
        if (extracted.isEmpty()) {
            logger.warn("No alert payload in email {} (subject: {})", messageId, email.getSubject());
            record(messageId, null, STATUS_INVALID, now);
            return EmailDisposition.INVALID_PAYLOAD;
        }
        SignalPayload payload = extracted.get();

        ExecutionResult result = executionEngine.execute(payload, SignalSource.EMAIL);
        if (result.isError() && result.isRetryable()) {
            logger.warn("Email {} left unprocessed for retry: {}", messageId, result.getDetail());
            return EmailDisposition.RETRY_LATER;
        }

        record(messageId, payload, result.statusLabel(), clock.instant());
        if (result.isRejected()
                && (result.getReason() == RejectionReason.INVALID_SIGNAL || result.getReason() == RejectionReason.UNAUTHORIZED)) {
            return EmailDisposition.REJECTED;
        }
        return EmailDisposition.EXECUTED;
    }

    /**
     * Message-ID header, else an MD5 of subject and body.
     */
    static String resolveMessageId(InboundEmail email) {
        if (email.getMessageId() != null && !email.getMessageId().isBlank()) {
            return email.getMessageId().trim();
        }
        String content = (email.getSubject() == null ? "" : email.getSubject()) + "\n"
                + (email.getBody() == null ? "" : email.getBody());
        return "md5:" + DigestUtils.md5DigestAsHex(content.getBytes(StandardCharsets.UTF_8));
    }

    private void record(String messageId, SignalPayload payload, String status, Instant at) {
        ProcessedEmail processed = ProcessedEmail.builder()
                .messageId(messageId)
                .barTs(payload != null ? clip(firstTime(payload)) : null)
                .instrument(payload != null ? clip(payload.getSymbol()) : null)
                .side(payload != null ? clip(payload.getSide()) : null)
                .processedAt(at)
                .resultStatus(status)
                .build();
        processedEmailRepository.save(processed);
    }

    private static String clip(String value) {
        if (value == null || value.length() <= ProcessedEmail.FIELD_LENGTH) {
            return value;
        }
        return value.substring(0, ProcessedEmail.FIELD_LENGTH);
    }

    private static String firstTime(SignalPayload payload) {
        if (payload.getTimeUnixMs() != null) {
            return payload.getTimeUnixMs();
        }
        return payload.getBarTs() != null ? payload.getBarTs() : payload.getTime();
    }
}
