package com.signalrelay.backend.service.signal;

import com.signalrelay.backend.model.RejectionReason;

/**
 * Thrown by {@link SignalNormalizer} for payloads that can never execute.
 */
public class SignalRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public SignalRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
