package com.marginledger.event;

public enum LedgerEventType {
    DEPOSITED,
    WITHDRAWN,
    SETTLED,
    POOL_PROVIDED,
    POOL_REDEEMED,
    OWNER_FEES_WITHDRAWN
}
