package com.signalrelay.backend.service.mail;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalrelay.backend.config.MailboxProperties;
import com.signalrelay.backend.model.ExecutionResult;
import com.signalrelay.backend.model.ProcessedEmail;
import com.signalrelay.backend.model.RejectionReason;
import com.signalrelay.backend.model.SignalPayload;
import com.signalrelay.backend.model.SignalSource;
import com.signalrelay.backend.repository.ProcessedEmailRepository;
import com.signalrelay.backend.service.SignalExecutionEngine;
import com.signalrelay.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class EmailAlertProcessorTest {

    private static final Instant NOW = Instant.parse("2024-05-03T12:00:00Z");
    private static final String BODY = "{\"side\":\"long\",\"symbol\":\"ETHUSDT\",\"bar_ts\":\"2024-05-03T11:45:00Z\"}";

    @Mock
    private ProcessedEmailRepository processedEmailRepository;

    @Mock
    private SignalExecutionEngine executionEngine;

    private EmailAlertProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new EmailAlertProcessor(processedEmailRepository,
                new EmailPayloadExtractor(new ObjectMapper()),
                executionEngine,
                new MailboxProperties(),
                new MutableClock(NOW));
    }

    @Test
    void process_filledSignal_shouldRecordAndAcknowledge() {
        when(processedEmailRepository.existsById("<a1@tv>")).thenReturn(false);
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.EMAIL)))
                .thenReturn(ExecutionResult.builder().status(ExecutionResult.Status.FILLED).orderId("ord-1").build());

        EmailDisposition disposition = processor.process(new InboundEmail("<a1@tv>", "Alert", BODY, NOW.minusSeconds(30)));

        assertEquals(EmailDisposition.EXECUTED, disposition);
        ArgumentCaptor<ProcessedEmail> saved = ArgumentCaptor.forClass(ProcessedEmail.class);
        verify(processedEmailRepository).save(saved.capture());
        assertEquals("<a1@tv>", saved.getValue().getMessageId());
        assertEquals("ok", saved.getValue().getResultStatus());
        assertEquals("ETHUSDT", saved.getValue().getInstrument());
        assertEquals("2024-05-03T11:45:00Z", saved.getValue().getBarTs());
    }

    @Test
    void process_alreadySeenMessage_shouldSkipEngine() {
        when(processedEmailRepository.existsById("<a1@tv>")).thenReturn(true);

        EmailDisposition disposition = processor.process(new InboundEmail("<a1@tv>", "Alert", BODY, NOW));

        assertEquals(EmailDisposition.ALREADY_PROCESSED, disposition);
        verify(executionEngine, never()).execute(any(), any());
    }

    @Test
    void process_oldMessage_shouldBeMarkedStale() {
        when(processedEmailRepository.existsById(anyString())).thenReturn(false);

        EmailDisposition disposition = processor.process(new InboundEmail("<old@tv>", "Alert", BODY, NOW.minusSeconds(600)));

        assertEquals(EmailDisposition.STALE_MESSAGE, disposition);
        ArgumentCaptor<ProcessedEmail> saved = ArgumentCaptor.forClass(ProcessedEmail.class);
        verify(processedEmailRepository).save(saved.capture());
        assertEquals(EmailAlertProcessor.STATUS_STALE, saved.getValue().getResultStatus());
        verify(executionEngine, never()).execute(any(), any());
    }

    @Test
    void process_unparseableBody_shouldBeQuarantined() {
        when(processedEmailRepository.existsById(anyString())).thenReturn(false);

        EmailDisposition disposition = processor.process(new InboundEmail("<bad@tv>", "Alert", "no json here", NOW));

        assertEquals(EmailDisposition.INVALID_PAYLOAD, disposition);
        assertTrue(disposition.shouldQuarantine());
        ArgumentCaptor<ProcessedEmail> saved = ArgumentCaptor.forClass(ProcessedEmail.class);
        verify(processedEmailRepository).save(saved.capture());
        assertEquals(EmailAlertProcessor.STATUS_INVALID, saved.getValue().getResultStatus());
    }

    @Test
    void process_retryableEngineError_shouldLeaveMessageUnmarked() {
        when(processedEmailRepository.existsById(anyString())).thenReturn(false);
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.EMAIL)))
                .thenReturn(ExecutionResult.error("price fetch failed", true));

        EmailDisposition disposition = processor.process(new InboundEmail("<r@tv>", "Alert", BODY, NOW));

        assertEquals(EmailDisposition.RETRY_LATER, disposition);
        assertEquals(false, disposition.shouldAcknowledge());
        verify(processedEmailRepository, never()).save(any());
    }

    @Test
    void process_policyRejection_shouldAcknowledgeWithReason() {
        when(processedEmailRepository.existsById(anyString())).thenReturn(false);
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.EMAIL)))
                .thenReturn(ExecutionResult.rejected(RejectionReason.COOLDOWN, "cooling down"));

        EmailDisposition disposition = processor.process(new InboundEmail("<c@tv>", "Alert", BODY, NOW));

        assertEquals(EmailDisposition.EXECUTED, disposition);
        ArgumentCaptor<ProcessedEmail> saved = ArgumentCaptor.forClass(ProcessedEmail.class);
        verify(processedEmailRepository).save(saved.capture());
        assertEquals("cooldown", saved.getValue().getResultStatus());
    }

    @Test
    void process_withOverlongPayloadFields_shouldClipRecordedEcho() {
        String body = "{\"side\":\"long\",\"symbol\":\"" + "X".repeat(300) + "\",\"bar_ts\":\"2024-05-03T11:45:00Z\"}";
        when(processedEmailRepository.existsById(anyString())).thenReturn(false);
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.EMAIL)))
                .thenReturn(ExecutionResult.rejected(RejectionReason.INVALID_SIGNAL, "symbol too long"));

        EmailDisposition disposition = processor.process(new InboundEmail("<long@tv>", "Alert", body, NOW));

        assertEquals(EmailDisposition.REJECTED, disposition);
        ArgumentCaptor<ProcessedEmail> saved = ArgumentCaptor.forClass(ProcessedEmail.class);
        verify(processedEmailRepository).save(saved.capture());
        assertEquals(ProcessedEmail.FIELD_LENGTH, saved.getValue().getInstrument().length());
        assertEquals("invalid_signal", saved.getValue().getResultStatus());
    }

    @Test
    void resolveMessageId_withoutHeader_shouldHashContent() {
        String first = EmailAlertProcessor.resolveMessageId(new InboundEmail(null, "Alert", BODY, NOW));
        String second = EmailAlertProcessor.resolveMessageId(new InboundEmail(" ", "Alert", BODY, NOW));
        String other = EmailAlertProcessor.resolveMessageId(new InboundEmail(null, "Alert", BODY + " ", NOW));

        assertTrue(first.startsWith("md5:"));
        assertEquals(first, second);
        assertTrue(!first.equals(other));
    }
}
