package com.marginledger.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marginledger.api.ApiHeaders;
import com.marginledger.auth.RoleRegistry;
import com.marginledger.domain.enums.LedgerRole;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the whole application against the test configuration and drives it over HTTP.
 */
@SpringBootTest
@AutoConfigureMockMvc
class MarginLedgerApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RoleRegistry roleRegistry;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void contextStarts_rolesBootstrapped_andMetersRegistered() {
        assertThat(roleRegistry.hasRole("position-engine", LedgerRole.LEDGER_CONTROLLER)).isTrue();
        assertThat(roleRegistry.hasRole("owner", LedgerRole.OWNER)).isTrue();
        assertThat(roleRegistry.hasRole("keeper", LedgerRole.KEEPER)).isTrue();
        assertThat(roleRegistry.hasRole("relayer", LedgerRole.RELAYER)).isTrue();

        assertThat(meterRegistry.find("pool.nav").tag("application", "margin-ledger").gauge()).isNotNull();
        assertThat(meterRegistry.find("trades.opened").counter()).isNotNull();
    }

    @Test
    void depositAndReadBack_overHttp() throws Exception {
        mockMvc.perform(post("/api/accounts/carol/deposit")
                        .header(ApiHeaders.CALLER_ID, "carol")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":250000000}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.balance").value(250_000000));

        mockMvc.perform(get("/api/accounts/carol"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.available").value(250_000000));
    }

    @Test
    void depositForSomeoneElse_isForbidden() throws Exception {
        mockMvc.perform(post("/api/accounts/dave/deposit")
                        .header(ApiHeaders.CALLER_ID, "carol")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"amount":1000000}
                        """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
    }

    @Test
    void unknownTrade_isNotFound() throws Exception {
        mockMvc.perform(get("/api/trades/424242"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }
}
