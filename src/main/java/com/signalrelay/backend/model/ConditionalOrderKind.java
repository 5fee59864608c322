package com.signalrelay.backend.model;

public enum ConditionalOrderKind {
    TAKE_PROFIT,
    STOP_LOSS
}
