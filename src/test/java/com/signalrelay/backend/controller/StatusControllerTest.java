package com.signalrelay.backend.controller;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.InstrumentMetadata;
import com.signalrelay.backend.model.PositionSide;
import com.signalrelay.backend.model.PositionSnapshot;
import com.signalrelay.backend.repository.ProcessedEmailRepository;
import com.signalrelay.backend.service.dedup.DedupStore;
import com.signalrelay.backend.service.gateway.ExchangeGateway;
import com.signalrelay.backend.service.gateway.GatewayCallGuard;
import com.signalrelay.backend.service.gateway.GatewayException;
import com.signalrelay.backend.service.position.PositionBook;
import com.signalrelay.backend.service.util.SymbolMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StatusController.class)
public class StatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TradingProperties tradingProperties;

    @MockBean
    private PositionBook positionBook;

    @MockBean
    private DedupStore dedupStore;

    @MockBean
    private ProcessedEmailRepository processedEmailRepository;

    @MockBean
    private SymbolMapper symbolMapper;

    @MockBean
    private ExchangeGateway exchangeGateway;

    @MockBean
    private GatewayCallGuard callGuard;

    @Test
    void health_shouldReportModeFlags() throws Exception {
        when(tradingProperties.isDryRun()).thenReturn(true);
        when(tradingProperties.isEnabled()).thenReturn(true);
        when(tradingProperties.getVenue()).thenReturn("mexc");
        when(tradingProperties.hasWebhookSecret()).thenReturn(false);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.venue").value("mexc"))
                .andExpect(jsonPath("$.secretConfigured").value(false));
    }

    @Test
    void status_shouldListPositionsAndDedupCounts() throws Exception {
        when(positionBook.snapshot()).thenReturn(List.of(new PositionSnapshot(
                "ETH_USDT", PositionSide.LONG, new BigDecimal("3000"), new BigDecimal("5"), null, null)));
        when(dedupStore.cacheSize()).thenReturn(3L);
        when(dedupStore.persistedCount()).thenReturn(12L);
        when(processedEmailRepository.count()).thenReturn(4L);

        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.positions[0].instrument").value("ETH_USDT"))
                .andExpect(jsonPath("$.positions[0].side").value("LONG"))
                .andExpect(jsonPath("$.dedup.cacheSize").value(3))
                .andExpect(jsonPath("$.dedup.persistedSignals").value(12))
                .andExpect(jsonPath("$.dedup.persistedEmails").value(4));
    }

    @Test
    void debugSymbol_shouldReturnInstrumentMetadata() throws Exception {
        when(symbolMapper.toVenueSymbol("BINANCE:BTCUSDT.P")).thenReturn(Optional.of("BTC_USDT"));
        when(callGuard.<InstrumentMetadata>call(anyString(), any())).thenReturn(InstrumentMetadata.builder()
                .instrument("BTC_USDT")
                .contractSize(new BigDecimal("0.0001"))
                .minContracts(1L)
                .build());

        mockMvc.perform(get("/debug/BINANCE:BTCUSDT.P"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.instrument").value("BTC_USDT"))
                .andExpect(jsonPath("$.metadata.minContracts").value(1));
    }

    @Test
    void debugSymbol_whenVenueFails_shouldReportFailure() throws Exception {
        when(symbolMapper.toVenueSymbol("ETHUSDT")).thenReturn(Optional.of("ETH_USDT"));
        when(callGuard.<InstrumentMetadata>call(anyString(), any()))
                .thenThrow(GatewayException.unavailable("venue timeout", null));

        mockMvc.perform(get("/debug/ETHUSDT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void debugSymbol_unmappable_shouldReturnBadRequest() throws Exception {
        when(symbolMapper.toVenueSymbol("EURUSD")).thenReturn(Optional.empty());

        mockMvc.perform(get("/debug/EURUSD"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verify(callGuard, never()).call(anyString(), any());
    }
}
