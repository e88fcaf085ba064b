package com.marginledger.domain.model;

import lombok.Builder;
import lombok.Value;

/** A validated, fresh reference price rescaled to six decimals. Timestamp in epoch seconds. */
@Value
@Builder
public class PricePoint {

    long pairId;
    long price;
    long timestamp;
    long round;
}
