package com.marginledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Price proof settings, read from the {@code ledger.oracle} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "ledger.oracle")
@Getter
@Setter
public class OracleProperties {

    /** HMAC-SHA256 key shared with the price feed that signs attestations. */
    private String signingKey;

    /** Oldest acceptable attestation, in seconds behind the current time. */
    private long maxAgeSeconds = 60;

    /** Tolerated clock skew for attestations stamped in the future. */
    private long maxForwardSkewSeconds = 180;
}
