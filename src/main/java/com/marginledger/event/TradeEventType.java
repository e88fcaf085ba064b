package com.marginledger.event;

/** Types of trade lifecycle changes published as {@link TradeEvent}. */
public enum TradeEventType {
    ORDER_PLACED,
    OPENED,
    EXECUTED,
    STOPS_UPDATED,
    CANCELLED,
    CLOSED
}
