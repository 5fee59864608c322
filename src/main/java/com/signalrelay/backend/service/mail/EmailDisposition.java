package com.signalrelay.backend.service.mail;

/**
 * What the mailbox should do with a message after processing.
 */
public enum EmailDisposition {
    ALREADY_PROCESSED(true, false),
    STALE_MESSAGE(true, false),
    INVALID_PAYLOAD(true, true),
    /** Engine reached a final result: filled, policy no-op or definitive failure. */
    EXECUTED(true, false),
    /** Engine rejected the content itself (invalid or unauthorized). */
    REJECTED(true, true),
    /** Transient failure: leave unseen for the next poll. */
    RETRY_LATER(false, false);

    private final boolean acknowledge;
    private final boolean quarantine;

    EmailDisposition(boolean acknowledge, boolean quarantine) {
        this.acknowledge = acknowledge;
        this.quarantine = quarantine;
    }

    /** Mark the message seen. */
    public boolean shouldAcknowledge() {
        return acknowledge;
    }

    /** Copy the message to the failed folder. */
    public boolean shouldQuarantine() {
        return quarantine;
    }
}
