package com.marginledger.exception;

/**
 * Thrown when a market order is submitted for an asset whose market the
 * asset registry reports as closed.
 */
public class MarketClosedException extends BaseException {

    public MarketClosedException(int assetId) {
        super(ErrorCode.MARKET_CLOSED, "Market is closed for asset " + assetId);
    }
}
