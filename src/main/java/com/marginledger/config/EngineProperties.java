package com.marginledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Position engine and settlement settings, read from the {@code ledger.engine} prefix.
 *
 * <p>Basis-point values are out of 10_000. The liquidation loss fraction is the share of
 * margin a position has lost when the price reaches its liquidation price.
 */
@Configuration
@ConfigurationProperties(prefix = "ledger.engine")
@Getter
@Setter
public class EngineProperties {

    /** Identity the engine uses when calling the custody ledger's privileged operations. */
    private String identity = "position-engine";

    /** Maximum relative distance between a trigger and an observed price still counted as a match. */
    private int toleranceBps = 5;

    private int liquidationLossBps = 8000;

    private int maxLeverage = 100;

    private long fundingIntervalSeconds = 2700;

    /** Clamp realized P&L to +/- the reserved margin before settlement. */
    private boolean capPnlToMargin = true;

    /** Share of every trader loss diverted to the owner fee accrual instead of pool NAV. */
    private int ownerFeePercent = 30;
}
