package com.marginledger.domain.model;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One decoded entry of a price proof, exactly as the oracle attested it.
 * The price is in the feed's native precision ({@code decimals}); the timestamp may be
 * seconds or milliseconds since epoch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceAttestation {

    private long pair;
    private BigInteger price;
    private int decimals;
    private long timestamp;
    private long round;
}
