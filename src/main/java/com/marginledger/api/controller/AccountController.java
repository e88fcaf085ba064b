package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.AmountRequest;
import com.marginledger.custody.CustodyLedger;
import com.marginledger.domain.model.AccountBalance;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for custody accounts.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/accounts/{id}/deposit -- add collateral (caller must be the account)</li>
 *   <li>POST /api/accounts/{id}/withdraw -- remove unlocked collateral</li>
 *   <li>GET /api/accounts/{id} -- balance, locked and available amounts</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/accounts")
public class AccountController {

    private final CustodyLedger custodyLedger;

    public AccountController(CustodyLedger custodyLedger) {
        this.custodyLedger = custodyLedger;
    }

    @PostMapping("/{accountId}/deposit")
    public AccountBalance deposit(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable String accountId,
            @RequestBody @Valid AmountRequest request) {
        return custodyLedger.deposit(caller, accountId, request.getAmount());
    }

    @PostMapping("/{accountId}/withdraw")
    public AccountBalance withdraw(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable String accountId,
            @RequestBody @Valid AmountRequest request) {
        return custodyLedger.withdraw(caller, accountId, request.getAmount());
    }

    @GetMapping("/{accountId}")
    public AccountBalance getAccount(@PathVariable String accountId) {
        return custodyLedger.balanceOf(accountId);
    }
}
