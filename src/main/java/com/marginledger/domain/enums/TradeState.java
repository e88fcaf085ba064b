package com.marginledger.domain.enums;

/**
 * Lifecycle state of a trade.
 * ORDER is a pending limit order holding reserved margin; OPEN is a live position.
 * CLOSED and CANCELLED are terminal.
 */
public enum TradeState {
    ORDER,
    OPEN,
    CLOSED,
    CANCELLED;

    public boolean isTerminal() {
        return this == CLOSED || this == CANCELLED;
    }
}
