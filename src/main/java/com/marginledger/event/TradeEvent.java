package com.marginledger.event;

import com.marginledger.domain.model.Trade;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the position engine whenever a trade changes state or its stops change.
 *
 * <p>For CLOSED events {@link #getRealizedPnl()} is the amount actually settled with the
 * counterparty pool (after clamping, if enabled). Listeners that must only see committed
 * changes use {@code @TransactionalEventListener}.
 */
public class TradeEvent extends ApplicationEvent {

    private final Trade trade;
    private final TradeEventType eventType;
    private final long realizedPnl;

    public TradeEvent(Object source, Trade trade, TradeEventType eventType, long realizedPnl) {
        super(source);
        this.trade = trade;
        this.eventType = eventType;
        this.realizedPnl = realizedPnl;
    }

    public TradeEvent(Object source, Trade trade, TradeEventType eventType) {
        this(source, trade, eventType, 0L);
    }

    public Trade getTrade() {
        return trade;
    }

    public TradeEventType getEventType() {
        return eventType;
    }

    public long getRealizedPnl() {
        return realizedPnl;
    }
}
