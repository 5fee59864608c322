package com.signalrelay.backend.service.util;

import com.signalrelay.backend.config.TradingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps chart symbols ("MEXC:ETHUSDT", "ETHUSDT.P", "ETH/USDT:USDT") to MEXC contract
 * symbols ("ETH_USDT").
 */
@Component
public class SymbolMapper {

    private static final Logger logger = LoggerFactory.getLogger(SymbolMapper.class);

    private static final String[] QUOTE_CURRENCIES = {"USDT", "USDC", "USD"};
    private static final String[] PERPETUAL_SUFFIXES = {".P", "-PERP", "_PERP", "PERP", "-SWAP", "_SWAP"};

    private final Map<String, String> overrides = new HashMap<>();

    public SymbolMapper(TradingProperties tradingProperties) {
        tradingProperties.getSymbolOverrides()
                .forEach((chart, venue) -> overrides.put(chart.trim().toUpperCase(Locale.ROOT), venue.trim()));
    }

    /**
     * @return the venue contract symbol, or empty if the symbol cannot be mapped
     */
    public Optional<String> toVenueSymbol(String chartSymbol) {
        if (chartSymbol == null || chartSymbol.isBlank()) {
            return Optional.empty();
        }
        String symbol = chartSymbol.trim().toUpperCase(Locale.ROOT);

        String override = overrides.get(symbol);
        if (override != null) {
            return Optional.of(override);
        }

        // Exchange prefix, e.g. "MEXC:ETHUSDT.P"
        int colon = symbol.indexOf(':');
        if (colon > 0 && !symbol.substring(0, colon).contains("/")) {
            symbol = symbol.substring(colon + 1);
        }

        // CCXT style "ETH/USDT:USDT"
        if (symbol.contains("/")) {
            String withoutSettle = symbol.contains(":") ? symbol.substring(0, symbol.indexOf(':')) : symbol;
            String[] parts = withoutSettle.split("/");
            return join(parts.length == 2 ? parts[0] : null, parts.length == 2 ? parts[1] : null, chartSymbol);
        }

        for (String suffix : PERPETUAL_SUFFIXES) {
            if (symbol.endsWith(suffix) && symbol.length() > suffix.length()) {
                symbol = symbol.substring(0, symbol.length() - suffix.length());
                break;
            }
        }

        if (symbol.contains("_") || symbol.contains("-")) {
            String[] parts = symbol.split("[_-]");
            return join(parts.length == 2 ? parts[0] : null, parts.length == 2 ? parts[1] : null, chartSymbol);
        }

        for (String quote : QUOTE_CURRENCIES) {
            if (symbol.endsWith(quote)) {
                return join(symbol.substring(0, symbol.length() - quote.length()), quote, chartSymbol);
            }
        }

        logger.warn("Could not map chart symbol '{}' to a venue contract", chartSymbol);
        return Optional.empty();
    }

    private Optional<String> join(String base, String quote, String original) {
        if (base == null || base.isEmpty() || quote == null || quote.isEmpty()
                || !base.chars().allMatch(Character::isLetterOrDigit)
                || !quote.chars().allMatch(Character::isLetterOrDigit)) {
            logger.warn("Could not map chart symbol '{}' to a venue contract", original);
            return Optional.empty();
        }
        return Optional.of(base + "_" + quote);
    }
}
