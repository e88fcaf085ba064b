package com.marginledger.exception;

/** A computed fixed-point value does not fit the container it is stored in. */
public class ArithmeticRangeException extends BaseException {

    public ArithmeticRangeException(String message) {
        super(ErrorCode.ARITHMETIC_RANGE, message);
    }

    public ArithmeticRangeException(String message, Throwable cause) {
        super(ErrorCode.ARITHMETIC_RANGE, message, cause);
    }
}
