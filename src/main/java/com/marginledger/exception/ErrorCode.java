package com.marginledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, ErrorCategory.PARAMETER),
    BAD_REQUEST("BAD_REQUEST", 400, ErrorCategory.PARAMETER),

    UNAUTHORIZED("UNAUTHORIZED", 403, ErrorCategory.AUTHORIZATION),

    INVALID_STATE("INVALID_STATE", 409, ErrorCategory.STATE),
    MARKET_CLOSED("MARKET_CLOSED", 409, ErrorCategory.STATE),

    INSUFFICIENT_AVAILABLE("INSUFFICIENT_AVAILABLE", 422, ErrorCategory.FUNDS),
    INSUFFICIENT_FUNDS("INSUFFICIENT_FUNDS", 422, ErrorCategory.FUNDS),
    OVER_UNLOCK("OVER_UNLOCK", 422, ErrorCategory.FUNDS),
    FUNDS_LOW("FUNDS_LOW", 422, ErrorCategory.FUNDS),
    LIQUIDITY_LOW("LIQUIDITY_LOW", 422, ErrorCategory.FUNDS),
    POOL_INSOLVENT("POOL_INSOLVENT", 422, ErrorCategory.FUNDS),
    INSUFFICIENT_SHARES("INSUFFICIENT_SHARES", 422, ErrorCategory.FUNDS),

    INVALID_AMOUNT("INVALID_AMOUNT", 400, ErrorCategory.PARAMETER),
    INVALID_PRICE("INVALID_PRICE", 400, ErrorCategory.PARAMETER),
    INVALID_LEVERAGE("INVALID_LEVERAGE", 400, ErrorCategory.PARAMETER),
    QTY_ZERO("QTY_ZERO", 400, ErrorCategory.PARAMETER),
    SHARES_ZERO("SHARES_ZERO", 400, ErrorCategory.PARAMETER),
    INVALID_STOP_RANGE("INVALID_STOP_RANGE", 400, ErrorCategory.PARAMETER),
    TRIGGER_NOT_SET("TRIGGER_NOT_SET", 400, ErrorCategory.PARAMETER),
    WRONG_ASSET("WRONG_ASSET", 400, ErrorCategory.PARAMETER),

    PRICE_NOT_NEAR("PRICE_NOT_NEAR", 409, ErrorCategory.PRICE),
    PROOF_INVALID("PROOF_INVALID", 400, ErrorCategory.PRICE),
    PROOF_BAD_TIMESTAMP("PROOF_BAD_TIMESTAMP", 400, ErrorCategory.PRICE),
    PROOF_TOO_OLD("PROOF_TOO_OLD", 400, ErrorCategory.PRICE),
    PROOF_PRICE_ZERO("PROOF_PRICE_ZERO", 400, ErrorCategory.PRICE),
    CALL_EXPIRED("CALL_EXPIRED", 400, ErrorCategory.PARAMETER),
    BAD_NONCE("BAD_NONCE", 409, ErrorCategory.AUTHORIZATION),
    BAD_SIGNATURE("BAD_SIGNATURE", 403, ErrorCategory.AUTHORIZATION),

    PROOF_RANGE("PROOF_RANGE", 422, ErrorCategory.ARITHMETIC_RANGE),
    ARITHMETIC_RANGE("ARITHMETIC_RANGE", 422, ErrorCategory.ARITHMETIC_RANGE),

    NOT_FOUND("NOT_FOUND", 404, ErrorCategory.NOT_FOUND),
    UNKNOWN_ASSET("UNKNOWN_ASSET", 404, ErrorCategory.NOT_FOUND),

    INTERNAL_ERROR("INTERNAL_ERROR", 500, ErrorCategory.INTERNAL);

    private final String code;
    private final int httpStatus;
    private final ErrorCategory category;
}
