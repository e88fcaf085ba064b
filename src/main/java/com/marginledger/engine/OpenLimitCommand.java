package com.marginledger.engine;

import lombok.Builder;
import lombok.Value;

/** Parameters of a limit order. Prices six-decimal; zero stop levels are unset. */
@Value
@Builder
public class OpenLimitCommand {

    int assetId;
    boolean longSide;
    int leverage;
    long lots;
    long targetPrice;
    long stopLoss;
    long takeProfit;
}
