package com.signalrelay.backend.controller;

import com.signalrelay.backend.model.ExecutionResult;
import com.signalrelay.backend.model.SignalPayload;
import com.signalrelay.backend.model.SignalSource;
import com.signalrelay.backend.service.SignalExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chart-alert webhook. The HTTP status tells the sender whether redelivering can help:
 * only retryable errors answer 5xx.
 */
@RestController
public class WebhookController {

    private static final Logger logger = LoggerFactory.getLogger(WebhookController.class);

    private final SignalExecutionEngine executionEngine;

    public WebhookController(SignalExecutionEngine executionEngine) {
        this.executionEngine = executionEngine;
    }

    @PostMapping({"/tv", "/webhook"})
    public ResponseEntity<Map<String, Object>> receiveSignal(@RequestBody SignalPayload payload) {
        logger.info("Webhook signal received: {}", payload);

        ExecutionResult result = executionEngine.execute(payload, SignalSource.WEBHOOK);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", result.isFilled() || (result.isRejected() && result.getReason().isPolicyNoOp()));
        response.put("status", result.statusLabel());
        response.put("result", result);
        return ResponseEntity.status(httpStatusFor(result)).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedBody(HttpMessageNotReadableException e) {
        logger.warn("Rejected malformed webhook body: {}", e.getMostSpecificCause().getMessage());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("status", "invalid_signal");
        response.put("message", "Malformed JSON body");
        return ResponseEntity.badRequest().body(response);
    }

    static HttpStatus httpStatusFor(ExecutionResult result) {
        switch (result.getStatus()) {
            case FILLED:
                return HttpStatus.OK;
            case REJECTED:
                switch (result.getReason()) {
                    case INVALID_SIGNAL:
                        return HttpStatus.BAD_REQUEST;
                    case UNAUTHORIZED:
                        return HttpStatus.FORBIDDEN;
                    default:
                        return HttpStatus.OK;
                }
            default:
                return result.isRetryable() ? HttpStatus.BAD_GATEWAY : HttpStatus.OK;
        }
    }
}
