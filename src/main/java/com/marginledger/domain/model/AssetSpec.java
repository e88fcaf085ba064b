package com.marginledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Listing of a tradable asset.
 *
 * <p>One lot equals {@code lotNumerator / lotDenominator} units of the base asset.
 * {@code halfSpread} is a six-decimal price offset charged on entry and exit (0 disables
 * spread); {@code fundingRate} is the signed six-decimal price adjustment per funding
 * interval folded into the exit price (0 disables funding).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetSpec {

    private int assetId;
    private long pairId;
    private String symbol;
    private long lotNumerator;
    private long lotDenominator;
    private boolean marketOpen;
    private long halfSpread;
    private long fundingRate;
}
