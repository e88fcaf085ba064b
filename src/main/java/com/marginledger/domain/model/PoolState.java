package com.marginledger.domain.model;

import lombok.Builder;
import lombok.Value;

/** Counterparty pool snapshot. Share price is six-decimal, 1_000000 while no shares exist. */
@Value
@Builder
public class PoolState {

    long nav;
    long totalShares;
    long ownerFees;
    long sharePrice;
}
