package com.marginledger.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountBalance {

    String accountId;
    long balance;
    long locked;

    public long getAvailable() {
        return balance - locked;
    }
}
