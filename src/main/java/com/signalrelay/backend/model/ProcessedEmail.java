package com.signalrelay.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Transport-level dedup record for alert emails, keyed by Message-ID.
 * Independent of {@link ProcessedSignal}: the same bar can arrive in several emails.
 */
@Entity
@Table(name = "processed_emails", indexes = {
        @Index(name = "idx_email_processed_at", columnList = "processedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedEmail {

    /** Payload echoes are cut to this length; the payload itself may be invalid. */
    public static final int FIELD_LENGTH = 64;

    @Id
    @Column(length = 512)
    private String messageId;

    @Column(length = FIELD_LENGTH)
    private String barTs;

    @Column(length = FIELD_LENGTH)
    private String instrument;

    @Column(length = FIELD_LENGTH)
    private String side;

    @Column(nullable = false)
    private Instant processedAt;

    private String resultStatus;
}
