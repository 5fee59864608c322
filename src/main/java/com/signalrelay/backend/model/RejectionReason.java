package com.signalrelay.backend.model;

public enum RejectionReason {
    INVALID_SIGNAL,
    STALE_SIGNAL,
    DUPLICATE_SIGNAL,
    COOLDOWN,
    ALREADY_IN_POSITION,
    TRADING_DISABLED,
    UNAUTHORIZED;

    /** Policy no-ops a transport should acknowledge as success. */
    public boolean isPolicyNoOp() {
        return this == DUPLICATE_SIGNAL || this == COOLDOWN || this == ALREADY_IN_POSITION;
    }
}
