package com.marginledger.domain.enums;

/**
 * Capabilities held by accounts. Each role is granted independently. OWNER and RELAYER have
 * exactly one holder: granting them moves the role, and they cannot be revoked.
 *
 * <ul>
 *   <li>OWNER: grants and revokes roles, withdraws accrued pool fees</li>
 *   <li>LEDGER_CONTROLLER: may lock, unlock and settle custody balances</li>
 *   <li>KEEPER: may execute limit orders and fire triggers for any trader, single or in batches</li>
 *   <li>RELAYER: may dispatch signed calls on behalf of traders</li>
 * </ul>
 */
public enum LedgerRole {
    OWNER(true),
    LEDGER_CONTROLLER(false),
    KEEPER(false),
    RELAYER(true);

    private final boolean singleHolder;

    LedgerRole(boolean singleHolder) {
        this.singleHolder = singleHolder;
    }

    public boolean isSingleHolder() {
        return singleHolder;
    }
}
