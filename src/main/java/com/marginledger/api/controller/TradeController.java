package com.marginledger.api.controller;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.request.OpenLimitRequest;
import com.marginledger.api.dto.request.OpenMarketRequest;
import com.marginledger.api.dto.request.ProofRequest;
import com.marginledger.api.dto.request.StopsRequest;
import com.marginledger.api.dto.request.TriggerCloseRequest;
import com.marginledger.domain.model.AssetExposure;
import com.marginledger.domain.model.Trade;
import com.marginledger.engine.OpenLimitCommand;
import com.marginledger.engine.OpenMarketCommand;
import com.marginledger.engine.PositionEngine;
import com.marginledger.oracle.ProofEncoding;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for orders and positions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/trades/limit -- place a limit order</li>
 *   <li>POST /api/trades/market -- open a position at the proof's price</li>
 *   <li>GET /api/trades/{id} -- one trade</li>
 *   <li>GET /api/trades?owner= -- an owner's trades, newest first</li>
 *   <li>DELETE /api/trades/{id} -- cancel a limit order</li>
 *   <li>POST /api/trades/{id}/execute -- fill a limit order (owner or keeper)</li>
 *   <li>PUT /api/trades/{id}/stops -- replace stop-loss and take-profit</li>
 *   <li>POST /api/trades/{id}/close -- close at the proof's price</li>
 *   <li>POST /api/trades/{id}/trigger -- close on a fired stop or liquidation (owner or keeper)</li>
 *   <li>GET /api/trades/exposure/{assetId} -- open lots per side</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/trades")
public class TradeController {

    private static final Logger log = LoggerFactory.getLogger(TradeController.class);

    private final PositionEngine positionEngine;

    public TradeController(PositionEngine positionEngine) {
        this.positionEngine = positionEngine;
    }

    @PostMapping("/limit")
    @ResponseStatus(HttpStatus.CREATED)
    public Trade openLimit(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid OpenLimitRequest request) {
        log.info("Limit order request from {}: asset={} long={} lots={} target={}",
                caller, request.getAssetId(), request.getLongSide(), request.getLots(), request.getTargetPrice());
        long id = positionEngine.openLimit(caller, OpenLimitCommand.builder()
                .assetId(request.getAssetId())
                .longSide(request.getLongSide())
                .leverage(request.getLeverage())
                .lots(request.getLots())
                .targetPrice(request.getTargetPrice())
                .stopLoss(request.getStopLoss())
                .takeProfit(request.getTakeProfit())
                .build());
        return positionEngine.trade(id);
    }

    @PostMapping("/market")
    @ResponseStatus(HttpStatus.CREATED)
    public Trade openMarket(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller, @RequestBody @Valid OpenMarketRequest request) {
        log.info("Market order request from {}: asset={} long={} lots={}",
                caller, request.getAssetId(), request.getLongSide(), request.getLots());
        long id = positionEngine.openMarket(caller, OpenMarketCommand.builder()
                .assetId(request.getAssetId())
                .longSide(request.getLongSide())
                .leverage(request.getLeverage())
                .lots(request.getLots())
                .stopLoss(request.getStopLoss())
                .takeProfit(request.getTakeProfit())
                .proof(ProofEncoding.decode(request.getProof()))
                .build());
        return positionEngine.trade(id);
    }

    @GetMapping("/{tradeId}")
    public Trade getTrade(@PathVariable long tradeId) {
        return positionEngine.trade(tradeId);
    }

    @GetMapping
    public List<Trade> listTrades(@RequestParam String owner) {
        return positionEngine.tradesOf(owner);
    }

    @DeleteMapping("/{tradeId}")
    public Trade cancel(@RequestHeader(ApiHeaders.CALLER_ID) String caller, @PathVariable long tradeId) {
        return positionEngine.cancel(caller, tradeId);
    }

    @PostMapping("/{tradeId}/execute")
    public Trade execute(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable long tradeId,
            @RequestBody @Valid ProofRequest request) {
        return positionEngine.execute(caller, tradeId, ProofEncoding.decode(request.getProof()));
    }

    @PutMapping("/{tradeId}/stops")
    public Trade updateStops(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable long tradeId,
            @RequestBody StopsRequest request) {
        return positionEngine.updateStops(caller, tradeId, request.getStopLoss(), request.getTakeProfit());
    }

    @PostMapping("/{tradeId}/close")
    public Trade closeMarket(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable long tradeId,
            @RequestBody @Valid ProofRequest request) {
        return positionEngine.closeMarket(caller, tradeId, ProofEncoding.decode(request.getProof()));
    }

    @PostMapping("/{tradeId}/trigger")
    public Trade closeOnTrigger(
            @RequestHeader(ApiHeaders.CALLER_ID) String caller,
            @PathVariable long tradeId,
            @RequestBody @Valid TriggerCloseRequest request) {
        return positionEngine.closeOnTrigger(
                caller, tradeId, request.getReason(), ProofEncoding.decode(request.getProof()));
    }

    @GetMapping("/exposure/{assetId}")
    public AssetExposure getExposure(@PathVariable int assetId) {
        return positionEngine.exposure(assetId);
    }
}
