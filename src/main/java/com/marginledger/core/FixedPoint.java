package com.marginledger.core;

import com.marginledger.exception.ArithmeticRangeException;
import java.math.BigInteger;

/**
 * Six-decimal fixed-point helpers. Intermediate products are computed in {@link BigInteger}
 * so they cannot overflow; only a final result that does not fit a {@code long} fails, with
 * {@link ArithmeticRangeException}.
 */
public final class FixedPoint {

    public static final long SCALE = 1_000_000L;

    private FixedPoint() {}

    /** {@code floor(a * b / c)} for non-negative operands, {@code c > 0}. */
    public static long mulDiv(long a, long b, long c) {
        return toLong(BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).divide(BigInteger.valueOf(c)), "mulDiv");
    }

    /** {@code ceil(a * b / c)} for non-negative operands, {@code c > 0}. */
    public static long mulDivCeil(long a, long b, long c) {
        BigInteger[] qr = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b)).divideAndRemainder(BigInteger.valueOf(c));
        BigInteger result = qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
        return toLong(result, "mulDivCeil");
    }

    public static long toLong(BigInteger value, String what) {
        if (value.bitLength() > 63) {
            throw new ArithmeticRangeException(what + " result " + value + " does not fit a 64-bit value");
        }
        return value.longValue();
    }

    public static long addExact(long a, long b, String what) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticRangeException(what + " overflows: " + a + " + " + b, e);
        }
    }

    public static long subtractExact(long a, long b, String what) {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            throw new ArithmeticRangeException(what + " overflows: " + a + " - " + b, e);
        }
    }
}
