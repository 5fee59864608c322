package com.signalrelay.backend.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class OrderResult {
    String orderId;
    /** Average fill price when the venue reports one, otherwise null. */
    BigDecimal fillPrice;

    public static OrderResult of(String orderId) {
        return new OrderResult(orderId, null);
    }
}
