package com.signalrelay.backend.controller;

import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.InstrumentMetadata;
import com.signalrelay.backend.repository.ProcessedEmailRepository;
import com.signalrelay.backend.service.dedup.DedupStore;
import com.signalrelay.backend.service.gateway.ExchangeGateway;
import com.signalrelay.backend.service.gateway.GatewayCallGuard;
import com.signalrelay.backend.service.gateway.GatewayException;
import com.signalrelay.backend.service.position.PositionBook;
import com.signalrelay.backend.service.util.SymbolMapper;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only operational surface. Nothing here trades.
 */
@RestController
public class StatusController {

    private final TradingProperties tradingProperties;
    private final PositionBook positionBook;
    private final DedupStore dedupStore;
    private final ProcessedEmailRepository processedEmailRepository;
    private final SymbolMapper symbolMapper;
    private final ExchangeGateway exchangeGateway;
    private final GatewayCallGuard callGuard;

    public StatusController(TradingProperties tradingProperties,
                            PositionBook positionBook,
                            DedupStore dedupStore,
                            ProcessedEmailRepository processedEmailRepository,
                            SymbolMapper symbolMapper,
                            ExchangeGateway exchangeGateway,
                            GatewayCallGuard callGuard) {
        this.tradingProperties = tradingProperties;
        this.positionBook = positionBook;
        this.dedupStore = dedupStore;
        this.processedEmailRepository = processedEmailRepository;
        this.symbolMapper = symbolMapper;
        this.exchangeGateway = exchangeGateway;
        this.callGuard = callGuard;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("dryRun", tradingProperties.isDryRun());
        response.put("tradingEnabled", tradingProperties.isEnabled());
        response.put("venue", tradingProperties.getVenue());
        response.put("secretConfigured", tradingProperties.hasWebhookSecret());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> dedup = new LinkedHashMap<>();
        dedup.put("cacheSize", dedupStore.cacheSize());
        dedup.put("persistedSignals", dedupStore.persistedCount());
        dedup.put("persistedEmails", processedEmailRepository.count());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("positions", positionBook.snapshot());
        response.put("dedup", dedup);
        response.put("dryRun", tradingProperties.isDryRun());
        response.put("tradingEnabled", tradingProperties.isEnabled());
        return ResponseEntity.ok(response);
    }

    /**
     * Symbol mapping and venue contract details for one chart symbol.
     */
    @GetMapping("/debug/{symbol}")
    public ResponseEntity<Map<String, Object>> debugSymbol(@PathVariable String symbol) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("input", symbol);

        Optional<String> mapped = symbolMapper.toVenueSymbol(symbol);
        if (mapped.isEmpty()) {
            response.put("success", false);
            response.put("message", "Cannot map symbol to a venue instrument");
            return ResponseEntity.badRequest().body(response);
        }
        String instrument = mapped.get();
        response.put("instrument", instrument);

        try {
            InstrumentMetadata metadata = callGuard.call("instrumentMetadata " + instrument,
                    () -> exchangeGateway.instrumentMetadata(instrument));
            response.put("success", true);
            response.put("metadata", metadata);
        } catch (GatewayException e) {
            response.put("success", false);
            response.put("message", e.getMessage());
        }
        return ResponseEntity.ok(response);
    }
}
