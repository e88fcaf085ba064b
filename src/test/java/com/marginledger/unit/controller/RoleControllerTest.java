package com.marginledger.unit.controller;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.controller.RoleController;
import com.marginledger.auth.RoleRegistry;
import com.marginledger.config.ApiResponseAdvice;
import com.marginledger.domain.enums.LedgerRole;
import com.marginledger.exception.GlobalExceptionHandler;
import com.marginledger.exception.UnauthorizedException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class RoleControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RoleRegistry roleRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new RoleController(roleRegistry))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    void getRoles_listsRoles() throws Exception {
        when(roleRegistry.rolesOf("keeper-2")).thenReturn(List.of(LedgerRole.KEEPER));

        mockMvc.perform(get("/api/roles/keeper-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.roles[0]").value("KEEPER"));
    }

    @Test
    void grant_asOwner_returnsUpdatedRoles() throws Exception {
        when(roleRegistry.rolesOf("keeper-2")).thenReturn(List.of(LedgerRole.KEEPER));

        mockMvc.perform(post("/api/roles/grant")
                        .header(ApiHeaders.CALLER_ID, "owner")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"accountId":"keeper-2","role":"KEEPER"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.accountId").value("keeper-2"));

        verify(roleRegistry).grant("owner", "keeper-2", LedgerRole.KEEPER);
    }

    @Test
    void revoke_notOwner_returns403() throws Exception {
        doThrow(new UnauthorizedException("Caller alice lacks role OWNER"))
                .when(roleRegistry).revoke("alice", "keeper", LedgerRole.KEEPER);

        mockMvc.perform(post("/api/roles/revoke")
                        .header(ApiHeaders.CALLER_ID, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"accountId":"keeper","role":"KEEPER"}
                        """))
                .andExpect(status().isForbidden());
    }
}
