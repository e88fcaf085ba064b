package com.marginledger.engine;

import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;

/**
 * Placement rules for stop levels, applied when a trade is created and whenever its stops
 * change. Zero means "not set" and is always allowed.
 *
 * <ul>
 *   <li>take-profit: at or above the reference price for a long, at or below for a short;</li>
 *   <li>stop-loss: between the liquidation price (inclusive) and the reference price
 *       (exclusive), on the losing side.</li>
 * </ul>
 */
public final class StopValidator {

    private StopValidator() {}

    public static void validate(boolean longSide, long referencePrice, long liquidationPrice, long stopLoss, long takeProfit) {
        if (stopLoss < 0 || takeProfit < 0) {
            throw invalid("Stop levels must not be negative", stopLoss, takeProfit, referencePrice);
        }
        if (takeProfit != 0) {
            boolean ok = longSide ? takeProfit >= referencePrice : takeProfit <= referencePrice;
            if (!ok) {
                throw invalid("Take-profit on the losing side", stopLoss, takeProfit, referencePrice);
            }
        }
        if (stopLoss != 0) {
            boolean ok = longSide
                    ? stopLoss >= liquidationPrice && stopLoss < referencePrice
                    : stopLoss > referencePrice && stopLoss <= liquidationPrice;
            if (!ok) {
                throw invalid("Stop-loss outside the liquidation range", stopLoss, takeProfit, referencePrice);
            }
        }
    }

    private static BusinessException invalid(String message, long stopLoss, long takeProfit, long referencePrice) {
        return new BusinessException(
                ErrorCode.INVALID_STOP_RANGE,
                String.format("%s: sl=%d tp=%d ref=%d", message, stopLoss, takeProfit, referencePrice));
    }
}
