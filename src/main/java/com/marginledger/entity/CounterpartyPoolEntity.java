package com.marginledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The single counterparty pool row. {@code nav} is the liquidity trader profits are paid
 * from and trader losses flow into; {@code ownerFees} accrues the fee share of losses and
 * is not part of NAV.
 */
@Entity
@Table(name = "counterparty_pool")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CounterpartyPoolEntity {

    public static final String MAIN_POOL_ID = "main";

    @Id
    @Column(length = 16)
    private String id;

    private long nav;

    @Column(name = "total_shares")
    private long totalShares;

    @Column(name = "owner_fees")
    private long ownerFees;
}
