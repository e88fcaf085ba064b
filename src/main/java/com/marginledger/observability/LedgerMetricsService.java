package com.marginledger.observability;

import com.marginledger.event.BatchCompletedEvent;
import com.marginledger.event.TradeEvent;
import com.marginledger.event.TradeEventType;
import com.marginledger.pool.LiquidityPoolService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Micrometer metrics for the ledger:
 * <ul>
 *   <li><b>trades.opened</b> (counter): positions opened, directly or by filling a limit order</li>
 *   <li><b>trades.closed</b> (counter, tag {@code reason}): positions closed</li>
 *   <li><b>batch.items.processed</b> / <b>batch.items.skipped</b> (counters): keeper batch items</li>
 *   <li><b>pool.nav</b> (gauge): counterparty pool NAV in six-decimal units</li>
 * </ul>
 *
 * <p>Counters listen after commit, so work rolled back never shows up. The gauge is read
 * lazily by Micrometer at scrape time and never takes the ledger lock.
 */
@Service
public class LedgerMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter tradesOpenedCounter;
    private final Counter batchProcessedCounter;
    private final Counter batchSkippedCounter;

    public LedgerMetricsService(MeterRegistry meterRegistry, LiquidityPoolService liquidityPoolService) {
        this.meterRegistry = meterRegistry;
        this.tradesOpenedCounter = Counter.builder("trades.opened")
                .description("Positions opened, directly or by executing a limit order")
                .register(meterRegistry);
        this.batchProcessedCounter = Counter.builder("batch.items.processed")
                .description("Keeper batch items executed or closed")
                .register(meterRegistry);
        this.batchSkippedCounter = Counter.builder("batch.items.skipped")
                .description("Keeper batch items skipped on a failed precondition")
                .register(meterRegistry);

        Gauge.builder("pool.nav", liquidityPoolService, LiquidityPoolService::currentNav)
                .description("Counterparty pool net asset value")
                .register(meterRegistry);
    }

    @TransactionalEventListener
    public void onTradeEvent(TradeEvent event) {
        if (event.getEventType() == TradeEventType.OPENED || event.getEventType() == TradeEventType.EXECUTED) {
            tradesOpenedCounter.increment();
        } else if (event.getEventType() == TradeEventType.CLOSED) {
            closedCounter(String.valueOf(event.getTrade().getCloseReason())).increment();
        }
    }

    @TransactionalEventListener
    public void onBatchCompleted(BatchCompletedEvent event) {
        batchProcessedCounter.increment(event.getResult().getProcessed());
        batchSkippedCounter.increment(event.getResult().getSkipped());
    }

    private Counter closedCounter(String reason) {
        return Counter.builder("trades.closed")
                .description("Positions closed")
                .tag("reason", reason)
                .register(meterRegistry);
    }
}
