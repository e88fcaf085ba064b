package com.marginledger.relay;

import lombok.Value;

/** A delegated call whose signature, expiry and sequence number have been verified. */
@Value
public class AuthenticatedCall {

    String trader;
    DelegatedCall call;
}
