package com.signalrelay.backend.service.util;

import com.signalrelay.backend.config.TradingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolMapperTest {

    private SymbolMapper symbolMapper;

    @BeforeEach
    void setUp() {
        TradingProperties properties = new TradingProperties();
        properties.getSymbolOverrides().put("PEPEUSDT.P", "1000PEPE_USDT");
        symbolMapper = new SymbolMapper(properties);
    }

    @Test
    void toVenueSymbol_shouldStripPrefixAndPerpetualSuffix() {
        assertEquals(Optional.of("ETH_USDT"), symbolMapper.toVenueSymbol("MEXC:ETHUSDT.P"));
        assertEquals(Optional.of("BTC_USDT"), symbolMapper.toVenueSymbol("BTCUSDT.P"));
        assertEquals(Optional.of("BTC_USDT"), symbolMapper.toVenueSymbol("BTCUSDTPERP"));
        assertEquals(Optional.of("SOL_USDT"), symbolMapper.toVenueSymbol("SOL-USDT-SWAP"));
        assertEquals(Optional.of("SOL_USDT"), symbolMapper.toVenueSymbol("sol_usdt"));
    }

    @Test
    void toVenueSymbol_shouldExpandBareQuotes() {
        assertEquals(Optional.of("XRP_USDT"), symbolMapper.toVenueSymbol("XRPUSDT"));
        assertEquals(Optional.of("XRP_USDC"), symbolMapper.toVenueSymbol("XRPUSDC"));
        assertEquals(Optional.of("BTC_USD"), symbolMapper.toVenueSymbol("BTCUSD"));
    }

    @Test
    void toVenueSymbol_shouldAcceptSlashNotation() {
        assertEquals(Optional.of("ETH_USDT"), symbolMapper.toVenueSymbol("ETH/USDT:USDT"));
        assertEquals(Optional.of("ETH_USDT"), symbolMapper.toVenueSymbol("MEXC:ETH/USDT:USDT"));
        assertEquals(Optional.of("ETH_USDT"), symbolMapper.toVenueSymbol("ETH/USDT"));
    }

    @Test
    void toVenueSymbol_shouldConsultOverridesFirst() {
        assertEquals(Optional.of("1000PEPE_USDT"), symbolMapper.toVenueSymbol("pepeusdt.p"));
    }

    @Test
    void toVenueSymbol_withUnknownQuote_shouldBeEmpty() {
        assertTrue(symbolMapper.toVenueSymbol("ETHBTC").isEmpty());
        assertTrue(symbolMapper.toVenueSymbol("").isEmpty());
        assertTrue(symbolMapper.toVenueSymbol("USDT").isEmpty());
    }
}
