package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.DelegatedCallRequest;
import com.marginledger.api.dto.request.RelayKeyRequest;
import com.marginledger.domain.model.Trade;
import com.marginledger.relay.DelegatedCall;
import com.marginledger.relay.DelegatedCallService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Delegated calls: traders register a relay key, the relayer submits calls they signed.
 */
@RestController
@RequestMapping("/api/relay")
public class RelayController {

    private final DelegatedCallService delegatedCallService;

    public RelayController(DelegatedCallService delegatedCallService) {
        this.delegatedCallService = delegatedCallService;
    }

    @PostMapping("/keys")
    public Map<String, String> registerKey(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid RelayKeyRequest request) {
        delegatedCallService.registerRelayKey(caller, caller, request.getSigningKey());
        return Map.of("trader", caller, "status", "REGISTERED");
    }

    @PostMapping("/dispatch")
    public Trade dispatch(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid DelegatedCallRequest request) {
        DelegatedCall call = DelegatedCall.builder()
                .trader(request.getTrader())
                .action(request.getAction())
                .parameters(request.getParameters())
                .nonce(request.getNonce())
                .expiresAt(request.getExpiresAt())
                .signature(request.getSignature())
                .build();
        return delegatedCallService.dispatch(caller, call);
    }
}
