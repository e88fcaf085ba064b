package com.marginledger.entity;

import com.marginledger.domain.enums.CloseReason;
import com.marginledger.domain.enums.TradeState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table: one row per order or position.
 * Ids come from the identity column and only ever increase.
 * Prices are six-decimal fixed point stored as BIGINT.
 */
@Entity
@Table(
        name = "trades",
        indexes = {@Index(name = "idx_trades_owner", columnList = "owner"),
                   @Index(name = "idx_trades_asset_state", columnList = "asset_id,state")})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String owner;

    @Column(name = "asset_id", nullable = false)
    private int assetId;

    @Column(name = "long_side", nullable = false)
    private boolean longSide;

    private long lots;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(12)", nullable = false)
    private TradeState state;

    @Column(name = "entry_price")
    private long entryPrice;

    @Column(name = "target_price")
    private long targetPrice;

    @Column(name = "stop_loss")
    private long stopLoss;

    @Column(name = "take_profit")
    private long takeProfit;

    @Column(name = "liquidation_price", updatable = false)
    private long liquidationPrice;

    private int leverage;

    @Column(name = "margin_reserved")
    private long marginReserved;

    @Column(name = "exit_price")
    private long exitPrice;

    @Column(name = "realized_pnl")
    private long realizedPnl;

    @Enumerated(EnumType.STRING)
    @Column(name = "close_reason", columnDefinition = "varchar(12)")
    private CloseReason closeReason;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "opened_at")
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;
}
