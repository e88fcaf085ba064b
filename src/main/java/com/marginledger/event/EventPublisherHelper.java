package com.marginledger.event;

import com.marginledger.domain.model.BatchResult;
import com.marginledger.domain.model.Trade;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed
 * factory methods for trade and ledger events.
 *
 * <p>Events are published inside the running ledger operation. Delivery to
 * {@code @TransactionalEventListener} listeners happens only once that operation commits,
 * so a rolled-back batch never reports the items it processed before aborting.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Trade ----

    public void publishOrderPlaced(Object source, Trade trade) {
        applicationEventPublisher.publishEvent(new TradeEvent(source, trade, TradeEventType.ORDER_PLACED));
    }

    public void publishOpened(Object source, Trade trade) {
        applicationEventPublisher.publishEvent(new TradeEvent(source, trade, TradeEventType.OPENED));
    }

    public void publishExecuted(Object source, Trade trade) {
        applicationEventPublisher.publishEvent(new TradeEvent(source, trade, TradeEventType.EXECUTED));
    }

    public void publishStopsUpdated(Object source, Trade trade) {
        applicationEventPublisher.publishEvent(new TradeEvent(source, trade, TradeEventType.STOPS_UPDATED));
    }

    public void publishCancelled(Object source, Trade trade) {
        applicationEventPublisher.publishEvent(new TradeEvent(source, trade, TradeEventType.CANCELLED));
    }

    public void publishClosed(Object source, Trade trade, long realizedPnl) {
        applicationEventPublisher.publishEvent(new TradeEvent(source, trade, TradeEventType.CLOSED, realizedPnl));
    }

    public void publishBatchCompleted(Object source, int assetId, String operation, BatchResult result) {
        applicationEventPublisher.publishEvent(new BatchCompletedEvent(source, assetId, operation, result));
    }

    // ---- Ledger ----

    public void publishLedgerEvent(Object source, String accountId, LedgerEventType eventType, long amount) {
        applicationEventPublisher.publishEvent(new LedgerEvent(source, accountId, eventType, amount));
    }
}
