package com.marginledger.engine;

import lombok.Builder;
import lombok.Value;

/** Parameters of a market order; the price comes from {@code proof}. */
@Value
@Builder
public class OpenMarketCommand {

    int assetId;
    boolean longSide;
    int leverage;
    long lots;
    long stopLoss;
    long takeProfit;
    byte[] proof;
}
