package com.marginledger.registry;

import com.marginledger.domain.model.AssetSpec;
import com.marginledger.domain.model.LotSize;
import com.marginledger.exception.ResourceNotFoundException;

/**
 * Listing of tradable assets: lot size, market status, spread and funding.
 *
 * <p>Every lookup for an asset that is not listed fails with
 * {@link ResourceNotFoundException} carrying {@code UNKNOWN_ASSET}.
 */
public interface AssetRegistry {

    AssetSpec getAsset(int assetId);

    default LotSize getLot(int assetId) {
        AssetSpec spec = getAsset(assetId);
        return new LotSize(spec.getLotNumerator(), spec.getLotDenominator());
    }

    default boolean isMarketOpen(int assetId) {
        return getAsset(assetId).isMarketOpen();
    }

    /** Six-decimal price offset charged on entry and exit; 0 when the asset carries no spread. */
    default long halfSpread(int assetId) {
        return getAsset(assetId).getHalfSpread();
    }

    /** Signed six-decimal funding rate per funding interval; 0 when the asset carries no funding. */
    default long fundingRate(int assetId) {
        return getAsset(assetId).getFundingRate();
    }

    /** Oracle pair id quoted in price proofs for this asset. */
    default long pairIdOf(int assetId) {
        return getAsset(assetId).getPairId();
    }
}
