package com.marginledger.exception;

import java.util.Map;

/**
 * Generic rule violation: invalid parameters, invalid state transitions, price
 * tolerance misses. The {@link ErrorCode} carries the precise reason.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
