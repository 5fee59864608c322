package com.signalrelay.backend.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Alert body as sent by the chart alert template, over the webhook or inside an email.
 * Values are kept loose here; {@code SignalNormalizer} turns this into a {@link Signal}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignalPayload {

    private String side;

    @JsonAlias({"symbol_tv", "ticker"})
    private String symbol;

    @JsonProperty("bar_ts")
    private String barTs;

    private String time;

    @JsonProperty("time_unix_ms")
    private String timeUnixMs;

    @ToString.Exclude
    private String secret;

    private BigDecimal notional;

    private Integer leverage;

    @JsonProperty("margin_mode")
    private String marginMode;

    private BigDecimal tp;

    private BigDecimal sl;

    @JsonProperty("tp_pct")
    private BigDecimal tpPct;

    @JsonProperty("sl_pct")
    private BigDecimal slPct;

    private String timeframe;
}
