package com.marginledger.event;

import org.springframework.context.ApplicationEvent;

/**
 * Published when funds move between an account and the outside world or the pool.
 * Lock and unlock are internal reservations and are not published.
 */
public class LedgerEvent extends ApplicationEvent {

    private final String accountId;
    private final LedgerEventType eventType;
    private final long amount;

    public LedgerEvent(Object source, String accountId, LedgerEventType eventType, long amount) {
        super(source);
        this.accountId = accountId;
        this.eventType = eventType;
        this.amount = amount;
    }

    public String getAccountId() {
        return accountId;
    }

    public LedgerEventType getEventType() {
        return eventType;
    }

    /** Signed for SETTLED (positive = paid to the account), otherwise positive. */
    public long getAmount() {
        return amount;
    }
}
