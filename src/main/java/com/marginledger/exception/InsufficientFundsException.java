package com.marginledger.exception;

import java.util.Map;

/** Balance, available collateral, pool liquidity or share holding too small for the request. */
public class InsufficientFundsException extends BaseException {

    public InsufficientFundsException(ErrorCode errorCode, String account, long required, long available) {
        super(
                errorCode,
                String.format("%s: account %s requires %d but has %d", errorCode.getCode(), account, required, available),
                Map.of("account", account, "required", required, "available", available));
    }
}
