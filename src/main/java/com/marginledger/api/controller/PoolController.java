package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.AmountRequest;
import com.marginledger.api.dto.request.SharesRequest;
import com.marginledger.domain.model.PoolState;
import com.marginledger.pool.LiquidityPoolService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the counterparty pool: liquidity provision, redemption and owner fees.
 */
@RestController
@RequestMapping("/api/pool")
public class PoolController {

    private final LiquidityPoolService liquidityPoolService;

    public PoolController(LiquidityPoolService liquidityPoolService) {
        this.liquidityPoolService = liquidityPoolService;
    }

    @GetMapping
    public PoolState getPool() {
        return liquidityPoolService.poolState();
    }

    @GetMapping("/shares")
    public Map<String, Object> getShares(@RequestParam String investor) {
        return Map.of("investor", investor, "shares", liquidityPoolService.sharesOf(investor));
    }

    @PostMapping("/provide")
    public Map<String, Long> provide(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid AmountRequest request) {
        long shares = liquidityPoolService.provide(caller, caller, request.getAmount());
        return Map.of("shares", shares);
    }

    @PostMapping("/redeem")
    public Map<String, Long> redeem(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid SharesRequest request) {
        long amount = liquidityPoolService.redeem(caller, caller, request.getShares());
        return Map.of("amount", amount);
    }

    @PostMapping("/owner-fees/withdraw")
    public Map<String, Long> withdrawOwnerFees(@RequestHeader(ApiHeaders.CALLER_ID) String caller) {
        return Map.of("amount", liquidityPoolService.withdrawOwnerFees(caller));
    }
}
