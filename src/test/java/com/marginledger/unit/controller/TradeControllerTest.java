package com.marginledger.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.controller.TradeController;
import com.marginledger.config.ApiResponseAdvice;
import com.marginledger.domain.enums.CloseReason;
import com.marginledger.domain.enums.TradeState;
import com.marginledger.domain.model.AssetExposure;
import com.marginledger.domain.model.Trade;
import com.marginledger.engine.OpenLimitCommand;
import com.marginledger.engine.OpenMarketCommand;
import com.marginledger.engine.PositionEngine;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.GlobalExceptionHandler;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for TradeController.
 *
 * <p>Verifies request mapping onto PositionEngine commands, the {@code $.data} envelope,
 * base64 proof decoding and error translation.
 */
class TradeControllerTest {

    /** base64 of "proof". */
    private static final String PROOF = "cHJvb2Y=";

    private MockMvc mockMvc;

    @Mock
    private PositionEngine positionEngine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new TradeController(positionEngine))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private Trade trade(long id, TradeState state) {
        return Trade.builder()
                .id(id)
                .owner("alice")
                .assetId(0)
                .longSide(true)
                .lots(10)
                .state(state)
                .targetPrice(100_000000L)
                .liquidationPrice(92_000000L)
                .leverage(10)
                .marginReserved(100_000000L)
                .build();
    }

    @Nested
    @DisplayName("Opening")
    class Opening {

        @Test
        @DisplayName("POST /limit maps the body onto a command and returns 201 with the trade")
        void openLimit() throws Exception {
            when(positionEngine.openLimit(eq("alice"), any())).thenReturn(7L);
            when(positionEngine.trade(7L)).thenReturn(trade(7L, TradeState.ORDER));

            mockMvc.perform(post("/api/trades/limit")
                            .header(ApiHeaders.CALLER_ID, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"assetId":0,"longSide":true,"leverage":10,"lots":10,"targetPrice":100000000,"stopLoss":95000000}
                            """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.id").value(7))
                    .andExpect(jsonPath("$.data.state").value("ORDER"))
                    .andExpect(jsonPath("$.data.liquidationPrice").value(92_000000L));

            ArgumentCaptor<OpenLimitCommand> captor = ArgumentCaptor.forClass(OpenLimitCommand.class);
            verify(positionEngine).openLimit(eq("alice"), captor.capture());
            assertThat(captor.getValue().getTargetPrice()).isEqualTo(100_000000L);
            assertThat(captor.getValue().getStopLoss()).isEqualTo(95_000000L);
            assertThat(captor.getValue().getTakeProfit()).isZero();
            assertThat(captor.getValue().isLongSide()).isTrue();
        }

        @Test
        @DisplayName("POST /market decodes the base64 proof")
        void openMarketDecodesProof() throws Exception {
            when(positionEngine.openMarket(eq("alice"), any())).thenReturn(8L);
            when(positionEngine.trade(8L)).thenReturn(trade(8L, TradeState.OPEN));

            mockMvc.perform(post("/api/trades/market")
                            .header(ApiHeaders.CALLER_ID, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"assetId":0,"longSide":false,"leverage":5,"lots":2,"proof":"%s"}
                            """.formatted(PROOF)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.state").value("OPEN"));

            ArgumentCaptor<OpenMarketCommand> captor = ArgumentCaptor.forClass(OpenMarketCommand.class);
            verify(positionEngine).openMarket(eq("alice"), captor.capture());
            assertThat(new String(captor.getValue().getProof(), StandardCharsets.UTF_8)).isEqualTo("proof");
        }

        @Test
        @DisplayName("Missing required fields return 400 without calling the engine")
        void missingFields() throws Exception {
            mockMvc.perform(post("/api/trades/limit")
                            .header(ApiHeaders.CALLER_ID, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"assetId":0,"lots":10}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

            verifyNoInteractions(positionEngine);
        }

        @Test
        @DisplayName("Missing caller header returns 403")
        void missingCaller() throws Exception {
            mockMvc.perform(post("/api/trades/limit")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"assetId":0,"longSide":true,"leverage":10,"lots":10,"targetPrice":100000000}
                            """))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
        }

        @Test
        @DisplayName("A malformed proof returns 400 PROOF_INVALID")
        void malformedProof() throws Exception {
            mockMvc.perform(post("/api/trades/market")
                            .header(ApiHeaders.CALLER_ID, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"assetId":0,"longSide":true,"leverage":5,"lots":2,"proof":"***"}
                            """))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("PROOF_INVALID"))
                    .andExpect(jsonPath("$.error.category").value("PRICE"));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("DELETE cancels as the caller")
        void cancel() throws Exception {
            when(positionEngine.cancel("alice", 7L)).thenReturn(trade(7L, TradeState.CANCELLED));

            mockMvc.perform(delete("/api/trades/7").header(ApiHeaders.CALLER_ID, "alice"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.state").value("CANCELLED"));
        }

        @Test
        @DisplayName("PUT /stops passes both levels through")
        void updateStops() throws Exception {
            when(positionEngine.updateStops("alice", 7L, 93_000000L, 0L)).thenReturn(trade(7L, TradeState.OPEN));

            mockMvc.perform(put("/api/trades/7/stops")
                            .header(ApiHeaders.CALLER_ID, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"stopLoss":93000000}
                            """))
                    .andExpect(status().isOk());

            verify(positionEngine).updateStops("alice", 7L, 93_000000L, 0L);
        }

        @Test
        @DisplayName("POST /trigger forwards the close reason")
        void closeOnTrigger() throws Exception {
            when(positionEngine.closeOnTrigger(eq("keeper"), eq(7L), eq(CloseReason.LIQUIDATION), any()))
                    .thenReturn(trade(7L, TradeState.CLOSED));

            mockMvc.perform(post("/api/trades/7/trigger")
                            .header(ApiHeaders.CALLER_ID, "keeper")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"reason":"LIQUIDATION","proof":"%s"}
                            """.formatted(PROOF)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.state").value("CLOSED"));
        }

        @Test
        @DisplayName("Engine state errors map to 409 with their code")
        void invalidStateIsConflict() throws Exception {
            when(positionEngine.closeMarket(eq("alice"), eq(7L), any()))
                    .thenThrow(new BusinessException(ErrorCode.INVALID_STATE, "Trade 7 is CLOSED"));

            mockMvc.perform(post("/api/trades/7/close")
                            .header(ApiHeaders.CALLER_ID, "alice")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                            {"proof":"%s"}
                            """.formatted(PROOF)))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("INVALID_STATE"))
                    .andExpect(jsonPath("$.error.path").value("/api/trades/7/close"));
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("GET ?owner lists the owner's trades")
        void listByOwner() throws Exception {
            when(positionEngine.tradesOf("alice"))
                    .thenReturn(List.of(trade(2L, TradeState.OPEN), trade(1L, TradeState.CLOSED)));

            mockMvc.perform(get("/api/trades").param("owner", "alice"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.length()").value(2))
                    .andExpect(jsonPath("$.data[0].id").value(2));
        }

        @Test
        @DisplayName("GET /exposure returns lots per side")
        void exposure() throws Exception {
            when(positionEngine.exposure(0))
                    .thenReturn(AssetExposure.builder().assetId(0).longLots(12).shortLots(3).build());

            mockMvc.perform(get("/api/trades/exposure/0"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.longLots").value(12))
                    .andExpect(jsonPath("$.data.shortLots").value(3));
        }
    }
}
