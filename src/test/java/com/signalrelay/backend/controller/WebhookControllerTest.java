package com.signalrelay.backend.controller;

import com.signalrelay.backend.model.ExecutionResult;
import com.signalrelay.backend.model.RejectionReason;
import com.signalrelay.backend.model.SignalPayload;
import com.signalrelay.backend.model.SignalSide;
import com.signalrelay.backend.model.SignalSource;
import com.signalrelay.backend.service.SignalExecutionEngine;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WebhookController.class)
public class WebhookControllerTest {

    private static final String BODY = "{\"side\":\"long\",\"symbol\":\"MEXC:ETHUSDT.P\",\"bar_ts\":\"2024-05-03T11:45:00Z\","
            + "\"secret\":\"s3cret\",\"notional\":50,\"tp_pct\":2,\"unexpected\":\"ignored\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SignalExecutionEngine executionEngine;

    @Test
    void receiveSignal_filled_shouldReturnOkWithResult() throws Exception {
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.WEBHOOK)))
                .thenReturn(ExecutionResult.builder()
                        .status(ExecutionResult.Status.FILLED)
                        .orderId("ord-1")
                        .instrument("ETH_USDT")
                        .side(SignalSide.LONG)
                        .contracts(5L)
                        .build());

        mockMvc.perform(post("/tv").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.result.orderId").value("ord-1"))
                .andExpect(jsonPath("$.result.contracts").value(5));

        ArgumentCaptor<SignalPayload> payload = ArgumentCaptor.forClass(SignalPayload.class);
        verify(executionEngine).execute(payload.capture(), eq(SignalSource.WEBHOOK));
        assertEquals("MEXC:ETHUSDT.P", payload.getValue().getSymbol());
        assertEquals("2024-05-03T11:45:00Z", payload.getValue().getBarTs());
        assertEquals(0, new BigDecimal("50").compareTo(payload.getValue().getNotional()));
        assertEquals("s3cret", payload.getValue().getSecret());
    }

    @Test
    void receiveSignal_policyNoOp_shouldReturnOk() throws Exception {
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.WEBHOOK)))
                .thenReturn(ExecutionResult.rejected(RejectionReason.DUPLICATE_SIGNAL, "already processed"));

        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("duplicate_signal"));
    }

    @Test
    void receiveSignal_invalid_shouldReturnBadRequest() throws Exception {
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.WEBHOOK)))
                .thenReturn(ExecutionResult.rejected(RejectionReason.INVALID_SIGNAL, "side must be long or short"));

        mockMvc.perform(post("/tv").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void receiveSignal_unauthorized_shouldReturnForbidden() throws Exception {
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.WEBHOOK)))
                .thenReturn(ExecutionResult.rejected(RejectionReason.UNAUTHORIZED, "secret mismatch"));

        mockMvc.perform(post("/tv").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isForbidden());
    }

    @Test
    void receiveSignal_retryableError_shouldReturnBadGateway() throws Exception {
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.WEBHOOK)))
                .thenReturn(ExecutionResult.error("price fetch failed", true));

        mockMvc.perform(post("/tv").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value("error_retryable"));
    }

    @Test
    void receiveSignal_definitiveError_shouldReturnOk() throws Exception {
        when(executionEngine.execute(any(SignalPayload.class), eq(SignalSource.WEBHOOK)))
                .thenReturn(ExecutionResult.error("entry order rejected", false));

        mockMvc.perform(post("/tv").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("order_failed"));
    }

    @Test
    void receiveSignal_malformedJson_shouldReturnBadRequestWithoutExecuting() throws Exception {
        mockMvc.perform(post("/tv").contentType(MediaType.APPLICATION_JSON).content("{\"side\": long"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("invalid_signal"));

        verify(executionEngine, never()).execute(any(), any());
    }
}
