package com.signalrelay.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of one signal execution. Rejections and errors are values, never exceptions.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResult {

    public enum Status {
        FILLED,
        REJECTED,
        ERROR
    }

    Status status;
    RejectionReason reason;
    String detail;
    String dedupKey;

    String orderId;
    String instrument;
    SignalSide side;
    Long contracts;
    BigDecimal fillPrice;
    PositionSide flippedFrom;

    String takeProfitOrderId;
    String stopLossOrderId;
    BigDecimal takeProfitPrice;
    BigDecimal stopLossPrice;

    boolean simulated;
    /** For ERROR results: whether redelivering the same signal may succeed. */
    boolean retryable;

    /** Non-fatal problems: leverage, margin mode, flip close, protective orders. */
    @Singular
    List<String> advisories;

    public static ExecutionResult rejected(RejectionReason reason, String detail) {
        return ExecutionResult.builder()
                .status(Status.REJECTED)
                .reason(reason)
                .detail(detail)
                .build();
    }

    public static ExecutionResult error(String detail, boolean retryable) {
        return ExecutionResult.builder()
                .status(Status.ERROR)
                .detail(detail)
                .retryable(retryable)
                .build();
    }

    @JsonIgnore
    public boolean isFilled() {
        return status == Status.FILLED;
    }

    @JsonIgnore
    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    @JsonIgnore
    public boolean isError() {
        return status == Status.ERROR;
    }

    /** Short status label used in dedup and email records. */
    public String statusLabel() {
        switch (status) {
            case FILLED:
                return simulated ? "simulated_ok" : "ok";
            case REJECTED:
                return reason.name().toLowerCase();
            default:
                return retryable ? "error_retryable" : "order_failed";
        }
    }
}
