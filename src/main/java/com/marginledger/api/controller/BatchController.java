package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.BatchRequest;
import com.marginledger.domain.model.BatchResult;
import com.marginledger.engine.PositionEngine;
import com.marginledger.oracle.ProofEncoding;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Keeper batch endpoints. Items that fail a precondition are reported as skipped in the
 * result rather than failing the request.
 */
@RestController
@RequestMapping("/api/batches")
public class BatchController {

    private final PositionEngine positionEngine;

    public BatchController(PositionEngine positionEngine) {
        this.positionEngine = positionEngine;
    }

    @PostMapping("/execute")
    public BatchResult execLimits(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid BatchRequest request) {
        return positionEngine.execLimits(
                caller, request.getAssetId(), request.getTradeIds(), ProofEncoding.decode(request.getProof()));
    }

    @PostMapping("/close")
    public BatchResult closeBatch(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid BatchRequest request) {
        return positionEngine.closeBatch(
                caller,
                request.getAssetId(),
                request.getReason(),
                request.getTradeIds(),
                ProofEncoding.decode(request.getProof()));
    }
}
