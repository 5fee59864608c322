package com.signalrelay.backend.service.mail;

import lombok.Value;

import java.time.Instant;

/**
 * Transport-neutral view of one alert email.
 */
@Value
public class InboundEmail {
    /** Message-ID header, may be null. */
    String messageId;
    String subject;
    String body;
    /** Sent or received date, may be null. */
    Instant sentAt;
}
