package com.marginledger.exception;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found with identifier: %s", resourceType, identifier));
    }

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, Object identifier) {
        super(errorCode, String.format("%s not found with identifier: %s", resourceType, identifier));
    }
}
