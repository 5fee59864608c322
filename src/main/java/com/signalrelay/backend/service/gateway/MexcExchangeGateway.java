package com.signalrelay.backend.service.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalrelay.backend.config.MexcApiConfig;
import com.signalrelay.backend.config.TradingProperties;
import com.signalrelay.backend.model.ConditionalOrderKind;
import com.signalrelay.backend.model.ExchangePosition;
import com.signalrelay.backend.model.InstrumentMetadata;
import com.signalrelay.backend.model.MarginMode;
import com.signalrelay.backend.model.OrderResult;
import com.signalrelay.backend.model.SignalSide;
import com.signalrelay.backend.model.TriggerDirection;
import com.signalrelay.backend.service.client.HttpClientService;
import com.signalrelay.backend.service.util.SignatureUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MEXC USDT-margined perpetual contracts, contract API v1.
 */
@Service
public class MexcExchangeGateway implements ExchangeGateway {

    private static final Logger logger = LoggerFactory.getLogger(MexcExchangeGateway.class);

    // order/submit side codes
    private static final int OPEN_LONG = 1;
    private static final int CLOSE_SHORT = 2;
    private static final int OPEN_SHORT = 3;
    private static final int CLOSE_LONG = 4;

    // order/submit type codes
    private static final int LIMIT = 1;
    private static final int MARKET = 5;

    // position_type codes
    private static final int POSITION_LONG = 1;
    private static final int POSITION_SHORT = 2;

    // planorder trigger types
    private static final int TRIGGER_GTE = 1;
    private static final int TRIGGER_LTE = 2;

    private static final int MAX_READ_ATTEMPTS = 3;

    private final MexcApiConfig mexcApiConfig;
    private final HttpClientService httpClientService;
    private final ObjectMapper objectMapper;

    private final MarginMode defaultMarginMode;
    private final int defaultLeverage;
    private final Map<String, MarginMode> marginModes = new ConcurrentHashMap<>();
    private final Map<String, Integer> leverages = new ConcurrentHashMap<>();

    public MexcExchangeGateway(MexcApiConfig mexcApiConfig,
                               HttpClientService httpClientService,
                               ObjectMapper objectMapper,
                               TradingProperties tradingProperties) {
        this.mexcApiConfig = mexcApiConfig;
        this.httpClientService = httpClientService;
        this.objectMapper = objectMapper;
        MarginMode configured = MarginMode.parse(tradingProperties.getDefaultMarginMode());
        this.defaultMarginMode = configured != null ? configured : MarginMode.ISOLATED;
        this.defaultLeverage = tradingProperties.getDefaultLeverage();
    }

    /**
     * Get latest traded price for a contract
     */
    @Override
    public BigDecimal getLastPrice(String instrument) {
        Map<String, String> params = new HashMap<>();
        params.put("symbol", instrument);

        JsonNode data = executeReadWithRetry("getLastPrice " + instrument,
                () -> httpClientService.get(mexcApiConfig.getFuturesApiV1Path("/contract/ticker"), createBasicHeaders(), params));

        BigDecimal lastPrice = decimal(data.path("lastPrice"));
        if (lastPrice == null || lastPrice.signum() <= 0) {
            throw GatewayException.rejected("No last price in ticker for " + instrument, null);
        }
        return lastPrice;
    }

    @Override
    public InstrumentMetadata instrumentMetadata(String instrument) {
        Map<String, String> params = new HashMap<>();
        params.put("symbol", instrument);

        JsonNode data = executeReadWithRetry("instrumentMetadata " + instrument,
                () -> httpClientService.get(mexcApiConfig.getFuturesApiV1Path("/contract/detail"), createBasicHeaders(), params));

        // detail returns an object for a single symbol, an array otherwise
        if (data.isArray()) {
            JsonNode match = null;
            for (JsonNode node : data) {
                if (instrument.equalsIgnoreCase(node.path("symbol").asText())) {
                    match = node;
                    break;
                }
            }
            if (match == null) {
                throw GatewayException.rejected("Unknown contract " + instrument, null);
            }
            data = match;
        }

        BigDecimal minVol = decimal(data.path("minVol"));
        return InstrumentMetadata.builder()
                .instrument(instrument)
                .contractSize(decimal(data.path("contractSize")))
                .minContracts(minVol != null ? minVol.longValue() : null)
                .priceUnit(decimal(data.path("priceUnit")))
                .maxLeverage(data.hasNonNull("maxLeverage") ? data.get("maxLeverage").asInt() : null)
                .build();
    }

    /**
     * Sets leverage on both position directions so a later flip opens at the same leverage.
     */
    @Override
    public void setLeverage(String instrument, int leverage) {
        MarginMode mode = marginModeFor(instrument);
        for (int positionType : new int[]{POSITION_LONG, POSITION_SHORT}) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("symbol", instrument);
            body.put("leverage", leverage);
            body.put("openType", mode.getOpenType());
            body.put("positionType", positionType);
            executePrivatePost("setLeverage " + instrument, "/private/position/change_leverage", body);
        }
        leverages.put(instrument, leverage);
        logger.info("Leverage for {} set to {}x ({})", instrument, leverage, mode);
    }

    /**
     * MEXC has no account-level margin mode switch; the mode travels as {@code openType} with
     * every leverage change and order, so it is remembered per instrument.
     */
    @Override
    public void setMarginMode(String instrument, MarginMode mode) {
        if (mode == null) {
            throw GatewayException.rejected("Unsupported margin mode", null);
        }
        marginModes.put(instrument, mode);
        logger.debug("Margin mode for {} set to {}", instrument, mode);
    }

    @Override
    public OrderResult createMarketOrder(String instrument, SignalSide side, long contracts, boolean reduceOnly) {
        Map<String, Object> body = orderBody(instrument, contracts);
        body.put("price", 0);
        body.put("side", reduceOnly ? closeSideCode(side) : openSideCode(side));
        body.put("type", MARKET);
        if (reduceOnly) {
            body.put("reduceOnly", true);
        }

        JsonNode data = executePrivatePost("createMarketOrder " + instrument, "/private/order/submit", body);
        String orderId = orderId(data);
        logger.info("MEXC market order {} placed: {} {} x{} reduceOnly={}", orderId, instrument, side, contracts, reduceOnly);
        return new OrderResult(orderId, decimal(data.path("dealAvgPrice")));
    }

    @Override
    public OrderResult createConditionalOrder(String instrument,
                                              ConditionalOrderKind kind,
                                              SignalSide positionSide,
                                              long contracts,
                                              BigDecimal triggerPrice,
                                              TriggerDirection triggerDirection,
                                              boolean reduceOnly) {
        Map<String, Object> body = orderBody(instrument, contracts);
        body.put("side", closeSideCode(positionSide));

        JsonNode data;
        if (kind == ConditionalOrderKind.TAKE_PROFIT) {
            // Resting reduce-only limit at the target
            body.put("price", triggerPrice.toPlainString());
            body.put("type", LIMIT);
            if (reduceOnly) {
                body.put("reduceOnly", true);
            }
            data = executePrivatePost("createTakeProfit " + instrument, "/private/order/submit", body);
        } else {
            body.put("triggerPrice", triggerPrice.toPlainString());
            body.put("triggerType", triggerDirection == TriggerDirection.ASCENDING ? TRIGGER_GTE : TRIGGER_LTE);
            body.put("executeCycle", 2);
            body.put("orderType", MARKET);
            body.put("trend", 1);
            data = executePrivatePost("createStopLoss " + instrument, "/private/planorder/place", body);
        }

        String orderId = orderId(data);
        logger.info("MEXC {} order {} placed: {} {} x{} @ {} ({})",
                kind, orderId, instrument, positionSide, contracts, triggerPrice, triggerDirection);
        return OrderResult.of(orderId);
    }

    /**
     * Open positions. Hedge-mode accounts may report a long and a short leg for one symbol;
     * those are netted into one signed size.
     */
    @Override
    public List<ExchangePosition> listPositions(String instrument) {
        Map<String, String> params = new HashMap<>();
        if (instrument != null && !instrument.isEmpty()) {
            params.put("symbol", instrument);
        }

        JsonNode data = executeReadWithRetry("listPositions " + (instrument != null ? instrument : "all"),
                () -> privateGet("/private/position/open_positions", params));

        Map<String, BigDecimal> netSize = new LinkedHashMap<>();
        Map<String, BigDecimal> entry = new HashMap<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                String symbol = node.path("symbol").asText();
                BigDecimal holdVol = decimal(node.path("holdVol"));
                if (symbol.isEmpty() || holdVol == null || holdVol.signum() == 0) {
                    continue;
                }
                BigDecimal signed = node.path("positionType").asInt() == POSITION_SHORT ? holdVol.negate() : holdVol;
                netSize.merge(symbol, signed, BigDecimal::add);
                BigDecimal avg = decimal(node.path("holdAvgPrice"));
                if (avg == null) {
                    avg = decimal(node.path("openAvgPrice"));
                }
                if (avg != null) {
                    entry.put(symbol, avg);
                }
            }
        }

        List<ExchangePosition> positions = new ArrayList<>();
        netSize.forEach((symbol, size) -> positions.add(new ExchangePosition(symbol, size, entry.get(symbol))));
        return positions;
    }

    private Map<String, Object> orderBody(String instrument, long contracts) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", instrument);
        body.put("vol", contracts);
        body.put("leverage", leverages.getOrDefault(instrument, defaultLeverage));
        body.put("openType", marginModeFor(instrument).getOpenType());
        return body;
    }

    private MarginMode marginModeFor(String instrument) {
        return marginModes.getOrDefault(instrument, defaultMarginMode);
    }

    private static int openSideCode(SignalSide side) {
        return side == SignalSide.LONG ? OPEN_LONG : OPEN_SHORT;
    }

    private static int closeSideCode(SignalSide positionSide) {
        return positionSide == SignalSide.LONG ? CLOSE_LONG : CLOSE_SHORT;
    }

    private static String orderId(JsonNode data) {
        if (data.isValueNode() && !data.asText().isEmpty()) {
            return data.asText();
        }
        if (data.hasNonNull("orderId")) {
            return data.get("orderId").asText();
        }
        if (data.hasNonNull("id")) {
            return data.get("id").asText();
        }
        throw GatewayException.rejected("Order response carried no order id: " + data, null);
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private ResponseEntity<String> privateGet(String path, Map<String, String> params) {
        requireAuth();
        String url = mexcApiConfig.getFuturesApiV1Path(path);
        HttpHeaders headers = createSignedHeaders(SignatureUtil.buildQueryString(params));
        return httpClientService.get(url, headers, params);
    }

    /**
     * Order-changing requests are sent exactly once: a blind retry could double an order.
     */
    private JsonNode executePrivatePost(String operation, String path, Map<String, Object> body) {
        requireAuth();
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Could not serialize " + operation + " request", false, e);
        }
        String url = mexcApiConfig.getFuturesApiV1Path(path);
        HttpHeaders headers = createSignedHeaders(json);
        logger.debug("Executing {} -> {}", operation, url);
        return unwrap(operation, execute(operation, () -> httpClientService.post(url, headers, json)));
    }

    /**
     * Executes an idempotent read with retry and exponential backoff on transient failures.
     */
    private JsonNode executeReadWithRetry(String operation, ApiCall apiCall) {
        long backoffMs = 250;
        GatewayException lastException = null;

        for (int attempt = 1; attempt <= MAX_READ_ATTEMPTS; attempt++) {
            try {
                logger.debug("Executing {} (attempt {}/{})", operation, attempt, MAX_READ_ATTEMPTS);
                return unwrap(operation, execute(operation, apiCall));
            } catch (GatewayException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastException = e;
                logger.warn("Attempt {}/{} failed for {}: {}", attempt, MAX_READ_ATTEMPTS, operation, e.getMessage());
                if (attempt < MAX_READ_ATTEMPTS) {
                    try {
                        Thread.sleep(backoffMs);
                        backoffMs *= 2;
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw GatewayException.unavailable(operation + " interrupted during retry backoff", ie);
                    }
                }
            }
        }

        logger.error("All attempts failed for {}", operation, lastException);
        throw lastException;
    }

    private ResponseEntity<String> execute(String operation, ApiCall apiCall) {
        try {
            ResponseEntity<String> response = apiCall.execute();
            if (response == null) {
                throw GatewayException.unavailable(operation + " returned no response", null);
            }
            if (response.getStatusCode().is5xxServerError()) {
                throw GatewayException.unavailable(operation + " failed with HTTP " + response.getStatusCode().value(), null);
            }
            if (response.getStatusCode().isError()) {
                throw GatewayException.rejected(operation + " failed with HTTP " + response.getStatusCode().value()
                        + ": " + response.getBody(), String.valueOf(response.getStatusCode().value()));
            }
            return response;
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().is5xxServerError()) {
                throw GatewayException.unavailable(operation + " failed with HTTP " + e.getStatusCode().value(), e);
            }
            throw new GatewayException(operation + " failed with HTTP " + e.getStatusCode().value()
                    + ": " + e.getResponseBodyAsString(), false, String.valueOf(e.getStatusCode().value()), e);
        } catch (RestClientException e) {
            throw GatewayException.unavailable(operation + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Unwraps the {@code {"success":..,"code":..,"data":..}} envelope.
     */
    private JsonNode unwrap(String operation, ResponseEntity<String> response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody() == null ? "" : response.getBody());
        } catch (JsonProcessingException e) {
            throw GatewayException.unavailable(operation + " returned malformed JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            throw GatewayException.unavailable(operation + " returned an empty body", null);
        }

        boolean success = root.path("success").asBoolean(false) || root.path("code").asInt(-1) == 0;
        if (!success) {
            String code = root.path("code").asText(null);
            String message = root.path("message").asText(root.path("msg").asText("unknown error"));
            logger.warn("MEXC rejected {}: code={} message={}", operation, code, message);
            throw GatewayException.rejected(operation + " rejected by MEXC: " + message + " (code " + code + ")", code);
        }
        return root.path("data");
    }

    private void requireAuth() {
        if (!mexcApiConfig.shouldUseAuth()) {
            throw GatewayException.rejected("MEXC API credentials are not configured", null);
        }
    }

    /**
     * Creates basic headers for public endpoints
     */
    private HttpHeaders createBasicHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.add("Accept", "application/json");
        return headers;
    }

    /**
     * Creates signed headers for private endpoints
     */
    private HttpHeaders createSignedHeaders(String parameterString) {
        HttpHeaders headers = createBasicHeaders();
        String timestamp = String.valueOf(System.currentTimeMillis());
        headers.set("ApiKey", mexcApiConfig.getKey());
        headers.set("Request-Time", timestamp);
        headers.set("Signature", SignatureUtil.generateContractV1Signature(
                mexcApiConfig.getSecret(), mexcApiConfig.getKey(), timestamp, parameterString));
        return headers;
    }

    @FunctionalInterface
    private interface ApiCall {
        ResponseEntity<String> execute();
    }
}
