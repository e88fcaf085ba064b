package com.marginledger.domain.enums;

/** Why an OPEN position was closed. Only MARKET is owner-initiated at an arbitrary price. */
public enum CloseReason {
    MARKET,
    STOP_LOSS,
    TAKE_PROFIT,
    LIQUIDATION;

    public boolean isTrigger() {
        return this != MARKET;
    }
}
