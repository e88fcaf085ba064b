package com.marginledger.observability;

import com.marginledger.domain.model.Trade;
import com.marginledger.event.LedgerEvent;
import com.marginledger.event.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes one line per committed trade transition or fund movement to the {@code AUDIT}
 * logger, which logback-spring.xml routes to its own file.
 */
@Component
public class LedgerAuditLogger {

    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    @TransactionalEventListener
    public void onTradeEvent(TradeEvent event) {
        Trade trade = event.getTrade();
        audit.info(
                "trade={} event={} owner={} asset={} side={} lots={} state={} entry={} exit={} pnl={}",
                trade.getId(),
                event.getEventType(),
                trade.getOwner(),
                trade.getAssetId(),
                trade.isLongSide() ? "LONG" : "SHORT",
                trade.getLots(),
                trade.getState(),
                trade.getEntryPrice(),
                trade.getExitPrice(),
                event.getRealizedPnl());
    }

    @TransactionalEventListener
    public void onLedgerEvent(LedgerEvent event) {
        audit.info("account={} event={} amount={}", event.getAccountId(), event.getEventType(), event.getAmount());
    }
}
