package com.signalrelay.backend.model;

/**
 * Transport a signal arrived through. Both feed the same execution path.
 */
public enum SignalSource {
    WEBHOOK,
    EMAIL
}
