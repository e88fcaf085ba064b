package com.marginledger.domain.model;

import com.marginledger.domain.enums.CloseReason;
import com.marginledger.domain.enums.TradeState;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only snapshot of an order or position, as returned to callers.
 *
 * <p>All prices are fixed-point with six decimals (100.5 is {@code 100_500000}); margin and
 * P&L are stablecoin units with six decimals. A zero stop-loss or take-profit means
 * "not set". The liquidation price is fixed when the trade is created and never changes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    private Long id;
    private String owner;
    private int assetId;
    private boolean longSide;
    private long lots;
    private TradeState state;

    private long entryPrice;
    private long targetPrice;
    private long stopLoss;
    private long takeProfit;
    private long liquidationPrice;

    private int leverage;
    private long marginReserved;

    private long exitPrice;
    private long realizedPnl;
    private CloseReason closeReason;

    private Instant createdAt;
    private Instant openedAt;
    private Instant closedAt;
}
