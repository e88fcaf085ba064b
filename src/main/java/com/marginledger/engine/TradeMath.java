package com.marginledger.engine;

import com.marginledger.core.FixedPoint;
import com.marginledger.exception.ArithmeticRangeException;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import java.math.BigInteger;

/**
 * Fixed-point position arithmetic. Prices, margin and P&L are six-decimal integers;
 * quantities are six-decimal base-asset units. Intermediate products are exact and a result
 * that does not fit a {@code long} fails with {@link ArithmeticRangeException}.
 */
public final class TradeMath {

    static final long BPS = 10_000L;

    private TradeMath() {}

    /**
     * Base-asset quantity of {@code lots}: {@code lots * 1e6 * numerator / denominator}.
     *
     * @throws BusinessException QTY_ZERO if lots or numerator is zero or the quantity rounds to zero
     */
    public static long quantity(long lots, long lotNumerator, long lotDenominator) {
        if (lots <= 0 || lotNumerator <= 0 || lotDenominator <= 0) {
            throw new BusinessException(
                    ErrorCode.QTY_ZERO,
                    String.format("Zero quantity: lots=%d, lot=%d/%d", lots, lotNumerator, lotDenominator));
        }
        BigInteger qty = BigInteger.valueOf(lots)
                .multiply(BigInteger.valueOf(FixedPoint.SCALE))
                .multiply(BigInteger.valueOf(lotNumerator))
                .divide(BigInteger.valueOf(lotDenominator));
        if (qty.signum() == 0) {
            throw new BusinessException(ErrorCode.QTY_ZERO, "Quantity rounds to zero for " + lots + " lots");
        }
        return FixedPoint.toLong(qty, "quantity");
    }

    public static long notional(long quantity, long price) {
        return FixedPoint.mulDiv(quantity, price, FixedPoint.SCALE);
    }

    /** {@code ceil(notional / leverage)}. */
    public static long margin(long notional, int leverage) {
        return FixedPoint.mulDivCeil(notional, 1, leverage);
    }

    /**
     * Price at which the position has lost {@code lossBps / 10000} of its margin:
     * {@code P * (1 - F/L)} for a long, {@code P * (1 + F/L)} for a short.
     */
    public static long liquidationPrice(long referencePrice, boolean longSide, int leverage, int lossBps) {
        long denominator = leverage * BPS;
        long factor = longSide ? denominator - lossBps : denominator + lossBps;
        return FixedPoint.mulDiv(referencePrice, Math.max(factor, 0), denominator);
    }

    /** Signed P&L {@code sign * quantity * (exit - entry) / 1e6}, truncated toward zero. */
    public static long pnl(boolean longSide, long quantity, long entryPrice, long exitPrice) {
        BigInteger diff = BigInteger.valueOf(exitPrice).subtract(BigInteger.valueOf(entryPrice));
        BigInteger raw = BigInteger.valueOf(quantity).multiply(diff).divide(BigInteger.valueOf(FixedPoint.SCALE));
        return FixedPoint.toLong(longSide ? raw : raw.negate(), "pnl");
    }

    public static long capToMargin(long pnl, long margin) {
        return Math.max(-margin, Math.min(margin, pnl));
    }

    /** Accrued funding: whole intervals elapsed times the signed per-interval rate. */
    public static long funding(long elapsedSeconds, long intervalSeconds, long fundingRate) {
        if (elapsedSeconds <= 0 || intervalSeconds <= 0 || fundingRate == 0) {
            return 0;
        }
        try {
            return Math.multiplyExact(elapsedSeconds / intervalSeconds, fundingRate);
        } catch (ArithmeticException e) {
            throw new ArithmeticRangeException("Funding accrual overflows", e);
        }
    }

    /** Execution price when opening: the trader pays the half spread on either side. */
    public static long entryPrice(long referencePrice, boolean longSide, long halfSpread) {
        long price = longSide
                ? FixedPoint.addExact(referencePrice, halfSpread, "entry price")
                : FixedPoint.subtractExact(referencePrice, halfSpread, "entry price");
        if (price <= 0) {
            throw new BusinessException(ErrorCode.INVALID_PRICE, "Spread-adjusted entry price is not positive: " + price);
        }
        return price;
    }

    /**
     * Settlement price when closing: half spread against the trader, then accrued funding
     * added for a long and subtracted for a short. Never below zero.
     */
    public static long exitPrice(long referencePrice, boolean longSide, long halfSpread, long funding) {
        long price = longSide
                ? FixedPoint.addExact(FixedPoint.subtractExact(referencePrice, halfSpread, "exit price"), funding, "exit price")
                : FixedPoint.subtractExact(FixedPoint.addExact(referencePrice, halfSpread, "exit price"), funding, "exit price");
        return Math.max(price, 0);
    }

    /** {@code |price - target| * 10000 <= target * toleranceBps}; the boundary is accepted. */
    public static boolean withinTolerance(long price, long target, int toleranceBps) {
        BigInteger distance = BigInteger.valueOf(price).subtract(BigInteger.valueOf(target)).abs()
                .multiply(BigInteger.valueOf(BPS));
        BigInteger band = BigInteger.valueOf(target).multiply(BigInteger.valueOf(toleranceBps));
        return distance.compareTo(band) <= 0;
    }
}
