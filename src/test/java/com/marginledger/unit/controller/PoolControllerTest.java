package com.marginledger.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.controller.PoolController;
import com.marginledger.config.ApiResponseAdvice;
import com.marginledger.domain.model.PoolState;
import com.marginledger.exception.GlobalExceptionHandler;
import com.marginledger.pool.LiquidityPoolService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class PoolControllerTest {

    private MockMvc mockMvc;

    @Mock
    private LiquidityPoolService liquidityPoolService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new PoolController(liquidityPoolService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    void getPool_returnsState() throws Exception {
        when(liquidityPoolService.poolState()).thenReturn(PoolState.builder()
                .nav(1_070_000000L)
                .totalShares(1_000_000000L)
                .ownerFees(30_000000L)
                .sharePrice(1_070000L)
                .build());

        mockMvc.perform(get("/api/pool"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sharePrice").value(1_070000))
                .andExpect(jsonPath("$.data.ownerFees").value(30_000000));
    }

    @Test
    void provide_actsForTheCaller() throws Exception {
        when(liquidityPoolService.provide("lp", "lp", 100_000000L)).thenReturn(93_457943L);

        mockMvc.perform(post("/api/pool/provide")
                        .header(ApiHeaders.CALLER_ID, "lp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":100000000}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.shares").value(93_457943));
    }

    @Test
    void redeem_returnsPayout() throws Exception {
        when(liquidityPoolService.redeem("lp", "lp", 50_000000L)).thenReturn(53_500000L);

        mockMvc.perform(post("/api/pool/redeem")
                        .header(ApiHeaders.CALLER_ID, "lp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"shares":50000000}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.amount").value(53_500000));
    }

    @Test
    void getShares_returnsHolding() throws Exception {
        when(liquidityPoolService.sharesOf("lp")).thenReturn(42L);

        mockMvc.perform(get("/api/pool/shares").param("investor", "lp"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.investor").value("lp"))
                .andExpect(jsonPath("$.data.shares").value(42));
    }
}
