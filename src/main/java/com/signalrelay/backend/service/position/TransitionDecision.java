package com.signalrelay.backend.service.position;

public enum TransitionDecision {
    /** Flat: open in the signal's direction. */
    OPEN,
    /** Opposite side held: close it, then open the signal's side. */
    FLIP,
    ALREADY_IN_POSITION,
    COOLDOWN
}
