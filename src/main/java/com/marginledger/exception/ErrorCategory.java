package com.marginledger.exception;

/**
 * Coarse classification of every {@link ErrorCode}.
 *
 * <p>Batch operations use the category to decide whether a failing item is skipped
 * or whether the whole batch aborts: STATE, PRICE, PARAMETER and NOT_FOUND failures
 * only concern the item itself, while FUNDS and ARITHMETIC_RANGE failures point at an
 * accounting inconsistency and must abort.
 */
public enum ErrorCategory {
    AUTHORIZATION(false),
    STATE(true),
    FUNDS(false),
    PARAMETER(true),
    PRICE(true),
    ARITHMETIC_RANGE(false),
    NOT_FOUND(true),
    INTERNAL(false);

    private final boolean skippableInBatch;

    ErrorCategory(boolean skippableInBatch) {
        this.skippableInBatch = skippableInBatch;
    }

    public boolean isSkippableInBatch() {
        return skippableInBatch;
    }
}
