package com.signalrelay.backend.service.protection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class ProtectiveOrderOutcome {
    String takeProfitOrderId;
    BigDecimal takeProfitPrice;
    String stopLossOrderId;
    BigDecimal stopLossPrice;
    @Singular
    List<String> advisories;
}
