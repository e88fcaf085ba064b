package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.RoleGrantRequest;
import com.marginledger.auth.RoleRegistry;
import com.marginledger.domain.enums.LedgerRole;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Role administration. Grant and revoke are OWNER only. */
@RestController
@RequestMapping("/api/roles")
public class RoleController {

    private final RoleRegistry roleRegistry;

    public RoleController(RoleRegistry roleRegistry) {
        this.roleRegistry = roleRegistry;
    }

    @GetMapping("/{accountId}")
    public Map<String, Object> getRoles(@PathVariable String accountId) {
        return rolesOf(accountId);
    }

    @PostMapping("/grant")
    public Map<String, Object> grant(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid RoleGrantRequest request) {
        roleRegistry.grant(caller, request.getAccountId(), request.getRole());
        return rolesOf(request.getAccountId());
    }

    @PostMapping("/revoke")
    public Map<String, Object> revoke(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid RoleGrantRequest request) {
        roleRegistry.revoke(caller, request.getAccountId(), request.getRole());
        return rolesOf(request.getAccountId());
    }

    private Map<String, Object> rolesOf(String accountId) {
        List<LedgerRole> roles = roleRegistry.rolesOf(accountId);
        return Map.of("accountId", accountId, "roles", roles);
    }
}
