package com.marginledger.domain.enums;

public enum BatchItemStatus {
    PROCESSED,
    SKIPPED
}
