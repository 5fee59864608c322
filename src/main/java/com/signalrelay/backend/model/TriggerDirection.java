package com.signalrelay.backend.model;

/**
 * Price movement that arms a conditional order.
 */
public enum TriggerDirection {
    /** Fires when the price rises to or above the trigger. */
    ASCENDING,
    /** Fires when the price falls to or below the trigger. */
    DESCENDING
}
