package com.signalrelay.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-wide trading settings. Read once at startup.
 */
@Data
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    /** Global kill switch. When false every signal is rejected with TRADING_DISABLED. */
    private boolean enabled = true;

    /** Simulate fills instead of sending orders to the venue. */
    private boolean dryRun = true;

    /** Venue identifier, part of every dedup key. */
    private String venue = "MEXC";

    /** Shared secret expected from the webhook transport; blank disables the check. */
    private String webhookSecret;

    /** Notional per signal in quote currency (USDT) when the payload carries none. */
    private BigDecimal defaultNotional = new BigDecimal("20");

    private int defaultLeverage = 5;

    /** isolated or cross */
    private String defaultMarginMode = "isolated";

    private long cooldownSeconds = 300;

    private Duration staleAfter = Duration.ofHours(48);

    /** Default take-profit distance in percent of entry, 0 disables. */
    private BigDecimal takeProfitPct = BigDecimal.ZERO;

    /** Default stop-loss distance in percent of entry, 0 disables. */
    private BigDecimal stopLossPct = BigDecimal.ZERO;

    /** Upper bound for any single exchange call. */
    private Duration gatewayTimeout = Duration.ofSeconds(10);

    /** Upper bound for waiting on another execution of the same instrument. */
    private Duration lockWaitTimeout = Duration.ofSeconds(30);

    private BigDecimal defaultContractSize = BigDecimal.ONE;

    /** Contract size fallbacks keyed by venue symbol, used when metadata is unavailable. */
    private Map<String, BigDecimal> contractSizes = new HashMap<>();

    /** Explicit chart-symbol to venue-symbol mappings, consulted before normalization. */
    private Map<String, String> symbolOverrides = new HashMap<>();

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }
}
