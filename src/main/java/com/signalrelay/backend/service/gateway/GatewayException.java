package com.signalrelay.backend.service.gateway;

/**
 * Failure talking to the trading venue.
 */
public class GatewayException extends RuntimeException {

    private final boolean retryable;
    private final String venueCode;

    public GatewayException(String message, boolean retryable) {
        this(message, retryable, null, null);
    }

    public GatewayException(String message, boolean retryable, Throwable cause) {
        this(message, retryable, null, cause);
    }

    public GatewayException(String message, boolean retryable, String venueCode, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
        this.venueCode = venueCode;
    }

    /** Venue business rejection: the venue understood the request and refused it. */
    public static GatewayException rejected(String message, String venueCode) {
        return new GatewayException(message, false, venueCode, null);
    }

    /** Transport failure, 5xx or timeout; the outcome may be retried later. */
    public static GatewayException unavailable(String message, Throwable cause) {
        return new GatewayException(message, true, null, cause);
    }

    /**
     * True for network, timeout and server-side failures. False when the venue definitively
     * rejected the request.
     */
    public boolean isRetryable() {
        return retryable;
    }

    public String getVenueCode() {
        return venueCode;
    }
}
