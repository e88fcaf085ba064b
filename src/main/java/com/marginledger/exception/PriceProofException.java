package com.marginledger.exception;

public class PriceProofException extends BaseException {

    public PriceProofException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public PriceProofException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
