package com.signalrelay.backend.model;

public enum SignalSide {
    LONG,
    SHORT;

    public SignalSide opposite() {
        return this == LONG ? SHORT : LONG;
    }

    public PositionSide toPositionSide() {
        return this == LONG ? PositionSide.LONG : PositionSide.SHORT;
    }

    /**
     * Parses the side field of an alert. buy/sell are accepted as aliases.
     * @return the side, or null if the value is not recognised
     */
    public static SignalSide parse(String raw) {
        if (raw == null) {
            return null;
        }
        switch (raw.trim().toLowerCase()) {
            case "long":
            case "buy":
                return LONG;
            case "short":
            case "sell":
                return SHORT;
            default:
                return null;
        }
    }

    /** Lower-case form used in dedup keys and stored records. */
    public String wireName() {
        return name().toLowerCase();
    }
}
