package com.marginledger.engine;

import com.marginledger.auth.RoleRegistry;
import com.marginledger.config.EngineProperties;
import com.marginledger.core.LedgerSequencer;
import com.marginledger.custody.CustodyLedger;
import com.marginledger.domain.enums.BatchItemStatus;
import com.marginledger.domain.enums.CloseReason;
import com.marginledger.domain.enums.LedgerRole;
import com.marginledger.domain.enums.TradeState;
import com.marginledger.domain.model.AssetExposure;
import com.marginledger.domain.model.AssetSpec;
import com.marginledger.domain.model.BatchItemOutcome;
import com.marginledger.domain.model.BatchResult;
import com.marginledger.domain.model.LotSize;
import com.marginledger.domain.model.PricePoint;
import com.marginledger.domain.model.Trade;
import com.marginledger.entity.TradeEntity;
import com.marginledger.event.EventPublisherHelper;
import com.marginledger.exception.BaseException;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import com.marginledger.exception.InsufficientFundsException;
import com.marginledger.exception.MarketClosedException;
import com.marginledger.exception.ResourceNotFoundException;
import com.marginledger.exception.UnauthorizedException;
import com.marginledger.mapper.TradeMapper;
import com.marginledger.oracle.PriceProofService;
import com.marginledger.registry.AssetRegistry;
import com.marginledger.repository.jpa.TradeJpaRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Order and position lifecycle: margin sizing, liquidation price fixing, stop management,
 * execution of limit orders and closing of positions against oracle prices.
 *
 * <p>State machine:
 * <pre>
 *   ORDER --execute--> OPEN --close--> CLOSED
 *   ORDER --cancel---> CANCELLED
 * </pre>
 * CLOSED and CANCELLED are terminal; any mutating call on such a trade fails with
 * INVALID_STATE. The liquidation price is computed once, when the trade is created, from
 * the target price (limit) or the entry price (market), and never recomputed.
 *
 * <p>Every money movement goes through the {@link CustodyLedger} under the engine's own
 * identity, which holds LEDGER_CONTROLLER. Every public operation runs through the
 * {@link LedgerSequencer}: a failure anywhere inside a single-trade call leaves no trace.
 *
 * <p>Batch calls ({@link #execLimits}, {@link #closeBatch}) are KEEPER only. They decode the
 * proof once and evaluate each id on its own: a trade that fails a state, price, parameter
 * or lookup check is skipped and reported, while a funds or arithmetic failure aborts the
 * whole batch. All checks for an item run before anything is written, so a skipped item
 * leaves no partial change. Exposure deltas of processed items are folded and written once
 * per batch.
 */
@Service
public class PositionEngine {

    private static final Logger log = LoggerFactory.getLogger(PositionEngine.class);

    private final TradeJpaRepository tradeJpaRepository;
    private final CustodyLedger custodyLedger;
    private final AssetRegistry assetRegistry;
    private final PriceProofService priceProofService;
    private final RoleRegistry roleRegistry;
    private final TriggerEvaluator triggerEvaluator;
    private final ExposureBook exposureBook;
    private final LedgerSequencer ledgerSequencer;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineProperties engineProperties;
    private final Clock clock;
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);

    public PositionEngine(
            TradeJpaRepository tradeJpaRepository,
            CustodyLedger custodyLedger,
            AssetRegistry assetRegistry,
            PriceProofService priceProofService,
            RoleRegistry roleRegistry,
            TriggerEvaluator triggerEvaluator,
            ExposureBook exposureBook,
            LedgerSequencer ledgerSequencer,
            EventPublisherHelper eventPublisherHelper,
            EngineProperties engineProperties,
            Clock clock) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.custodyLedger = custodyLedger;
        this.assetRegistry = assetRegistry;
        this.priceProofService = priceProofService;
        this.roleRegistry = roleRegistry;
        this.triggerEvaluator = triggerEvaluator;
        this.exposureBook = exposureBook;
        this.ledgerSequencer = ledgerSequencer;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    // ---- Opening ----

    /**
     * Places a limit order: reserves margin at the target price and records an ORDER.
     *
     * @return the new trade id
     */
    public long openLimit(String trader, OpenLimitCommand command) {
        return ledgerSequencer.execute(() -> {
            assetRegistry.getAsset(command.getAssetId());
            if (command.getTargetPrice() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_PRICE, "Target price must be positive");
            }
            requireLeverage(command.getLeverage());

            long target = command.getTargetPrice();
            long margin = requiredMargin(command.getAssetId(), command.getLots(), target, command.getLeverage());
            requireAvailable(trader, margin);
            long liquidation = TradeMath.liquidationPrice(
                    target, command.isLongSide(), command.getLeverage(), engineProperties.getLiquidationLossBps());
            StopValidator.validate(
                    command.isLongSide(), target, liquidation, command.getStopLoss(), command.getTakeProfit());

            custodyLedger.lock(engineIdentity(), trader, margin);
            TradeEntity trade = tradeJpaRepository.save(TradeEntity.builder()
                    .owner(trader)
                    .assetId(command.getAssetId())
                    .longSide(command.isLongSide())
                    .lots(command.getLots())
                    .state(TradeState.ORDER)
                    .targetPrice(target)
                    .stopLoss(command.getStopLoss())
                    .takeProfit(command.getTakeProfit())
                    .liquidationPrice(liquidation)
                    .leverage(command.getLeverage())
                    .marginReserved(margin)
                    .createdAt(Instant.now(clock))
                    .build());

            log.info(
                    "Limit order {} placed: {} {} {} lots of asset {} at {} x{}, margin={}, liq={}",
                    trade.getId(), trader, side(trade.isLongSide()), trade.getLots(), trade.getAssetId(),
                    target, trade.getLeverage(), margin, liquidation);
            eventPublisherHelper.publishOrderPlaced(this, tradeMapper.toDomain(trade));
            return trade.getId();
        });
    }

    /**
     * Opens a position at the proof's price, adjusted by the asset's half spread.
     *
     * @return the new trade id
     */
    public long openMarket(String trader, OpenMarketCommand command) {
        return ledgerSequencer.execute(() -> {
            AssetSpec asset = assetRegistry.getAsset(command.getAssetId());
            if (!asset.isMarketOpen()) {
                throw new MarketClosedException(command.getAssetId());
            }
            requireLeverage(command.getLeverage());

            PricePoint price = priceProofService.fetch(command.getProof(), command.getAssetId());
            long entry = TradeMath.entryPrice(price.getPrice(), command.isLongSide(), asset.getHalfSpread());
            long margin = requiredMargin(command.getAssetId(), command.getLots(), entry, command.getLeverage());
            requireAvailable(trader, margin);
            long liquidation = TradeMath.liquidationPrice(
                    entry, command.isLongSide(), command.getLeverage(), engineProperties.getLiquidationLossBps());
            StopValidator.validate(
                    command.isLongSide(), entry, liquidation, command.getStopLoss(), command.getTakeProfit());

            custodyLedger.lock(engineIdentity(), trader, margin);
            Instant now = Instant.now(clock);
            TradeEntity trade = tradeJpaRepository.save(TradeEntity.builder()
                    .owner(trader)
                    .assetId(command.getAssetId())
                    .longSide(command.isLongSide())
                    .lots(command.getLots())
                    .state(TradeState.OPEN)
                    .entryPrice(entry)
                    .stopLoss(command.getStopLoss())
                    .takeProfit(command.getTakeProfit())
                    .liquidationPrice(liquidation)
                    .leverage(command.getLeverage())
                    .marginReserved(margin)
                    .createdAt(now)
                    .openedAt(now)
                    .build());
            applyExposure(trade.getAssetId(), trade.isLongSide(), trade.getLots());

            log.info(
                    "Position {} opened: {} {} {} lots of asset {} at {} (ref {}) x{}, margin={}, liq={}",
                    trade.getId(), trader, side(trade.isLongSide()), trade.getLots(), trade.getAssetId(),
                    entry, price.getPrice(), trade.getLeverage(), margin, liquidation);
            eventPublisherHelper.publishOpened(this, tradeMapper.toDomain(trade));
            return trade.getId();
        });
    }

    // ---- Order management ----

    /** Cancels a pending limit order and releases its margin. Owner only. */
    public Trade cancel(String trader, long tradeId) {
        return ledgerSequencer.execute(() -> {
            TradeEntity trade = loadTrade(tradeId);
            requireOwner(trade, trader);
            requireState(trade, TradeState.ORDER);

            custodyLedger.unlock(engineIdentity(), trade.getOwner(), trade.getMarginReserved());
            trade.setState(TradeState.CANCELLED);
            trade.setClosedAt(Instant.now(clock));
            tradeJpaRepository.save(trade);

            log.info("Limit order {} cancelled by {}, released {}", tradeId, trader, trade.getMarginReserved());
            Trade snapshot = tradeMapper.toDomain(trade);
            eventPublisherHelper.publishCancelled(this, snapshot);
            return snapshot;
        });
    }

    /**
     * Fills a limit order when the proof's price is within tolerance of its target.
     * Owner or KEEPER. The liquidation price is left as computed at creation.
     */
    public Trade execute(String caller, long tradeId, byte[] proof) {
        return ledgerSequencer.execute(() -> {
            TradeEntity trade = loadTrade(tradeId);
            requireOwnerOrKeeper(trade, caller);
            requireState(trade, TradeState.ORDER);

            PricePoint price = priceProofService.fetch(proof, trade.getAssetId());
            BatchItemOutcome outcome = fillOrder(trade, price.getPrice());
            exposureBook.apply(trade.getAssetId(), outcome.getLongLotsDelta(), outcome.getShortLotsDelta());
            return tradeMapper.toDomain(trade);
        });
    }

    /**
     * Replaces both stop levels. Owner only, ORDER or OPEN. Levels are validated against the
     * target price of an order or the entry price of a position.
     */
    public Trade updateStops(String trader, long tradeId, long stopLoss, long takeProfit) {
        return ledgerSequencer.execute(() -> {
            TradeEntity trade = loadTrade(tradeId);
            requireOwner(trade, trader);
            requireState(trade, TradeState.ORDER, TradeState.OPEN);

            long reference = trade.getState() == TradeState.ORDER ? trade.getTargetPrice() : trade.getEntryPrice();
            StopValidator.validate(trade.isLongSide(), reference, trade.getLiquidationPrice(), stopLoss, takeProfit);

            trade.setStopLoss(stopLoss);
            trade.setTakeProfit(takeProfit);
            tradeJpaRepository.save(trade);

            log.info("Trade {} stops updated: sl={} tp={}", tradeId, stopLoss, takeProfit);
            Trade snapshot = tradeMapper.toDomain(trade);
            eventPublisherHelper.publishStopsUpdated(this, snapshot);
            return snapshot;
        });
    }

    // ---- Closing ----

    /** Closes a position at the proof's price. Owner only. */
    public Trade closeMarket(String trader, long tradeId, byte[] proof) {
        return ledgerSequencer.execute(() -> {
            TradeEntity trade = loadTrade(tradeId);
            requireOwner(trade, trader);
            requireState(trade, TradeState.OPEN);

            PricePoint price = priceProofService.fetch(proof, trade.getAssetId());
            BatchItemOutcome outcome = closePosition(trade, price.getPrice(), CloseReason.MARKET);
            exposureBook.apply(trade.getAssetId(), outcome.getLongLotsDelta(), outcome.getShortLotsDelta());
            return tradeMapper.toDomain(trade);
        });
    }

    /**
     * Closes a position whose stop-loss, take-profit or liquidation trigger is fired by the
     * proof's price. Owner or KEEPER.
     */
    public Trade closeOnTrigger(String caller, long tradeId, CloseReason reason, byte[] proof) {
        return ledgerSequencer.execute(() -> {
            requireTriggerReason(reason);
            TradeEntity trade = loadTrade(tradeId);
            requireOwnerOrKeeper(trade, caller);
            requireState(trade, TradeState.OPEN);

            PricePoint price = priceProofService.fetch(proof, trade.getAssetId());
            checkTrigger(trade, reason, price.getPrice());
            BatchItemOutcome outcome = closePosition(trade, price.getPrice(), reason);
            exposureBook.apply(trade.getAssetId(), outcome.getLongLotsDelta(), outcome.getShortLotsDelta());
            return tradeMapper.toDomain(trade);
        });
    }

    // ---- Batches ----

    /** Fills every listed limit order of {@code assetId} whose target is near the proof's price. KEEPER only. */
    public BatchResult execLimits(String caller, int assetId, List<Long> tradeIds, byte[] proof) {
        return ledgerSequencer.execute(() -> {
            roleRegistry.require(caller, LedgerRole.KEEPER);
            PricePoint price = priceProofService.fetch(proof, assetId);

            BatchResult result = runBatch(assetId, tradeIds, trade -> {
                requireState(trade, TradeState.ORDER);
                return fillOrder(trade, price.getPrice());
            });
            log.info("execLimits asset {} at {}: executed={}, skipped={}",
                    assetId, price.getPrice(), result.getProcessed(), result.getSkipped());
            eventPublisherHelper.publishBatchCompleted(this, assetId, "execLimits", result);
            return result;
        });
    }

    /** Closes every listed position of {@code assetId} whose {@code reason} trigger fires. KEEPER only. */
    public BatchResult closeBatch(String caller, int assetId, CloseReason reason, List<Long> tradeIds, byte[] proof) {
        return ledgerSequencer.execute(() -> {
            roleRegistry.require(caller, LedgerRole.KEEPER);
            requireTriggerReason(reason);
            PricePoint price = priceProofService.fetch(proof, assetId);

            BatchResult result = runBatch(assetId, tradeIds, trade -> {
                requireState(trade, TradeState.OPEN);
                checkTrigger(trade, reason, price.getPrice());
                return closePosition(trade, price.getPrice(), reason);
            });
            log.info("closeBatch {} asset {} at {}: closed={}, skipped={}",
                    reason, assetId, price.getPrice(), result.getProcessed(), result.getSkipped());
            eventPublisherHelper.publishBatchCompleted(this, assetId, "closeBatch", result);
            return result;
        });
    }

    private BatchResult runBatch(int assetId, List<Long> tradeIds, Function<TradeEntity, BatchItemOutcome> item) {
        List<BatchItemOutcome> outcomes = new ArrayList<>(tradeIds.size());
        for (Long tradeId : tradeIds) {
            try {
                TradeEntity trade = loadTrade(tradeId);
                if (trade.getAssetId() != assetId) {
                    throw new BusinessException(
                            ErrorCode.WRONG_ASSET,
                            String.format("Trade %d is on asset %d, not %d", tradeId, trade.getAssetId(), assetId));
                }
                outcomes.add(item.apply(trade));
            } catch (BaseException e) {
                if (!e.getCategory().isSkippableInBatch()) {
                    log.error("Batch on asset {} aborted at trade {}: {}", assetId, tradeId, e.getMessage());
                    throw e;
                }
                log.debug("Batch item {} skipped: {}", tradeId, e.getMessage());
                outcomes.add(BatchItemOutcome.skipped(tradeId, e.getErrorCode().getCode()));
            }
        }

        long longDelta = 0;
        long shortDelta = 0;
        for (BatchItemOutcome outcome : outcomes) {
            longDelta += outcome.getLongLotsDelta();
            shortDelta += outcome.getShortLotsDelta();
        }
        exposureBook.apply(assetId, longDelta, shortDelta);
        return BatchResult.of(outcomes);
    }

    // ---- Reads ----

    public Trade trade(long tradeId) {
        return ledgerSequencer.execute(() -> tradeMapper.toDomain(loadTrade(tradeId)));
    }

    public TradeState stateOf(long tradeId) {
        return trade(tradeId).getState();
    }

    public boolean isLong(long tradeId) {
        return trade(tradeId).isLongSide();
    }

    public AssetExposure exposure(int assetId) {
        return ledgerSequencer.execute(() -> exposureBook.get(assetId));
    }

    public List<Trade> tradesOf(String owner) {
        return ledgerSequencer.execute(() -> tradeMapper.toDomainList(tradeJpaRepository.findByOwnerOrderByIdDesc(owner)));
    }

    // ---- Transitions shared by single and batch calls ----

    /** ORDER to OPEN. Caller has checked the state; exposure is applied by the caller. */
    private BatchItemOutcome fillOrder(TradeEntity trade, long referencePrice) {
        if (!TradeMath.withinTolerance(referencePrice, trade.getTargetPrice(), engineProperties.getToleranceBps())) {
            throw new BusinessException(
                    ErrorCode.PRICE_NOT_NEAR,
                    String.format("Price %d not within %d bps of target %d",
                            referencePrice, engineProperties.getToleranceBps(), trade.getTargetPrice()));
        }
        long entry = TradeMath.entryPrice(
                referencePrice, trade.isLongSide(), assetRegistry.halfSpread(trade.getAssetId()));

        trade.setEntryPrice(entry);
        trade.setTargetPrice(0);
        trade.setState(TradeState.OPEN);
        trade.setOpenedAt(Instant.now(clock));
        tradeJpaRepository.save(trade);

        log.info("Limit order {} executed at {} (ref {})", trade.getId(), entry, referencePrice);
        eventPublisherHelper.publishExecuted(this, tradeMapper.toDomain(trade));
        return outcome(trade, trade.getLots(), 0);
    }

    /** OPEN to CLOSED: release margin, settle P&L. Exposure is applied by the caller. */
    private BatchItemOutcome closePosition(TradeEntity trade, long referencePrice, CloseReason reason) {
        AssetSpec asset = assetRegistry.getAsset(trade.getAssetId());
        Instant now = Instant.now(clock);
        long elapsed = trade.getOpenedAt() != null ? Duration.between(trade.getOpenedAt(), now).getSeconds() : 0;
        long funding = TradeMath.funding(elapsed, engineProperties.getFundingIntervalSeconds(), asset.getFundingRate());
        long exit = TradeMath.exitPrice(referencePrice, trade.isLongSide(), asset.getHalfSpread(), funding);

        LotSize lot = assetRegistry.getLot(trade.getAssetId());
        long quantity = TradeMath.quantity(trade.getLots(), lot.getNumerator(), lot.getDenominator());
        long pnl = TradeMath.pnl(trade.isLongSide(), quantity, trade.getEntryPrice(), exit);
        if (engineProperties.isCapPnlToMargin()) {
            pnl = TradeMath.capToMargin(pnl, trade.getMarginReserved());
        }

        custodyLedger.unlock(engineIdentity(), trade.getOwner(), trade.getMarginReserved());
        custodyLedger.settle(engineIdentity(), trade.getOwner(), pnl);

        trade.setExitPrice(exit);
        trade.setRealizedPnl(pnl);
        trade.setCloseReason(reason);
        trade.setState(TradeState.CLOSED);
        trade.setClosedAt(now);
        tradeJpaRepository.save(trade);

        log.info("Position {} closed ({}) at {} (ref {}, funding {}), pnl={}",
                trade.getId(), reason, exit, referencePrice, funding, pnl);
        eventPublisherHelper.publishClosed(this, tradeMapper.toDomain(trade), pnl);
        return outcome(trade, -trade.getLots(), pnl);
    }

    /** Processed outcome carrying a signed lot delta on the trade's side. */
    private static BatchItemOutcome outcome(TradeEntity trade, long lots, long pnl) {
        return BatchItemOutcome.builder()
                .tradeId(trade.getId())
                .status(BatchItemStatus.PROCESSED)
                .longLotsDelta(trade.isLongSide() ? lots : 0)
                .shortLotsDelta(trade.isLongSide() ? 0 : lots)
                .realizedPnl(pnl)
                .build();
    }

    // ---- Checks ----

    private void checkTrigger(TradeEntity trade, CloseReason reason, long price) {
        triggerEvaluator.check(
                reason, trade.isLongSide(), trade.getStopLoss(), trade.getTakeProfit(), trade.getLiquidationPrice(), price);
    }

    private long requiredMargin(int assetId, long lots, long price, int leverage) {
        LotSize lot = assetRegistry.getLot(assetId);
        long quantity = TradeMath.quantity(lots, lot.getNumerator(), lot.getDenominator());
        return TradeMath.margin(TradeMath.notional(quantity, price), leverage);
    }

    private void requireAvailable(String trader, long margin) {
        long available = custodyLedger.available(trader);
        if (available < margin) {
            throw new InsufficientFundsException(ErrorCode.INSUFFICIENT_FUNDS, trader, margin, available);
        }
    }

    private void requireLeverage(int leverage) {
        if (leverage < 1 || leverage > engineProperties.getMaxLeverage()) {
            throw new BusinessException(
                    ErrorCode.INVALID_LEVERAGE,
                    String.format("Leverage %d outside 1..%d", leverage, engineProperties.getMaxLeverage()));
        }
    }

    private static void requireTriggerReason(CloseReason reason) {
        if (reason == null || !reason.isTrigger()) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Close reason must be a trigger: " + reason);
        }
    }

    private void requireOwner(TradeEntity trade, String caller) {
        if (!trade.getOwner().equals(caller)) {
            throw new UnauthorizedException(String.format("Caller %s does not own trade %d", caller, trade.getId()));
        }
    }

    private void requireOwnerOrKeeper(TradeEntity trade, String caller) {
        if (!trade.getOwner().equals(caller) && !roleRegistry.hasRole(caller, LedgerRole.KEEPER)) {
            throw new UnauthorizedException(
                    String.format("Caller %s is neither owner of trade %d nor a keeper", caller, trade.getId()));
        }
    }

    private static void requireState(TradeEntity trade, TradeState... allowed) {
        for (TradeState state : allowed) {
            if (trade.getState() == state) {
                return;
            }
        }
        throw new BusinessException(
                ErrorCode.INVALID_STATE,
                String.format("Trade %d is %s", trade.getId(), trade.getState()));
    }

    private TradeEntity loadTrade(long tradeId) {
        return tradeJpaRepository.findById(tradeId).orElseThrow(() -> new ResourceNotFoundException("Trade", tradeId));
    }

    private void applyExposure(int assetId, boolean longSide, long lots) {
        exposureBook.apply(assetId, longSide ? lots : 0, longSide ? 0 : lots);
    }

    private String engineIdentity() {
        return engineProperties.getIdentity();
    }

    private static String side(boolean longSide) {
        return longSide ? "LONG" : "SHORT";
    }
}
