package com.signalrelay.backend.model;

public enum PositionSide {
    FLAT,
    LONG,
    SHORT;

    public static PositionSide fromSignedSize(java.math.BigDecimal signedSize) {
        if (signedSize == null) {
            return FLAT;
        }
        int sign = signedSize.signum();
        return sign > 0 ? LONG : sign < 0 ? SHORT : FLAT;
    }

    public boolean matches(SignalSide side) {
        return side != null && side.toPositionSide() == this;
    }
}
