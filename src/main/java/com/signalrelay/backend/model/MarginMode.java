package com.signalrelay.backend.model;

public enum MarginMode {
    ISOLATED(1),
    CROSS(2);

    private final int openType;

    MarginMode(int openType) {
        this.openType = openType;
    }

    /** MEXC contract API {@code openType} value. */
    public int getOpenType() {
        return openType;
    }

    public static MarginMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        switch (raw.trim().toLowerCase()) {
            case "isolated":
            case "iso":
                return ISOLATED;
            case "cross":
            case "crossed":
                return CROSS;
            default:
                return null;
        }
    }
}
