package com.marginledger.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marginledger.engine.TradeMath;
import com.marginledger.exception.ArithmeticRangeException;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TradeMath covering sizing, liquidation pricing, P&L rounding, spread and
 * funding adjustments and the tolerance band.
 */
class TradeMathTest {

    @Nested
    @DisplayName("Sizing")
    class Sizing {

        @Test
        @DisplayName("Quantity follows the lot fraction in six-decimal units")
        void quantityFromLots() {
            assertThat(TradeMath.quantity(10, 1, 1)).isEqualTo(10_000000L);
            assertThat(TradeMath.quantity(3, 1, 1000)).isEqualTo(3_000L);
        }

        @Test
        @DisplayName("Zero lots, a zero numerator or a quantity that rounds to zero fail QTY_ZERO")
        void zeroQuantity() {
            assertThatThrownBy(() -> TradeMath.quantity(0, 1, 1))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.QTY_ZERO);
            assertThatThrownBy(() -> TradeMath.quantity(5, 0, 1))
                    .extracting("errorCode").isEqualTo(ErrorCode.QTY_ZERO);
            assertThatThrownBy(() -> TradeMath.quantity(1, 1, 10_000_000L))
                    .extracting("errorCode").isEqualTo(ErrorCode.QTY_ZERO);
        }

        @Test
        @DisplayName("Margin rounds up so the pool is never under-collateralized")
        void marginRoundsUp() {
            long notional = TradeMath.notional(TradeMath.quantity(1, 1, 1), 100_000001L);

            assertThat(notional).isEqualTo(100_000001L);
            assertThat(TradeMath.margin(notional, 10)).isEqualTo(10_000001L);
            assertThat(TradeMath.margin(100_000000L, 10)).isEqualTo(10_000000L);
        }

        @Test
        @DisplayName("A notional beyond 64 bits fails ARITHMETIC_RANGE")
        void notionalOverflow() {
            assertThatThrownBy(() -> TradeMath.notional(Long.MAX_VALUE / 2, 4_000000L))
                    .isInstanceOf(ArithmeticRangeException.class);
        }
    }

    @Nested
    @DisplayName("Liquidation price")
    class Liquidation {

        @Test
        @DisplayName("Long at 100 with leverage 10 liquidates at 92, short at 108")
        void leverageTen() {
            assertThat(TradeMath.liquidationPrice(100_000000L, true, 10, 8000)).isEqualTo(92_000000L);
            assertThat(TradeMath.liquidationPrice(100_000000L, false, 10, 8000)).isEqualTo(108_000000L);
        }

        @Test
        @DisplayName("Leverage 1 long liquidates at a fifth of the price")
        void leverageOne() {
            assertThat(TradeMath.liquidationPrice(100_000000L, true, 1, 8000)).isEqualTo(20_000000L);
        }

        @Test
        @DisplayName("Result is floored")
        void floored() {
            assertThat(TradeMath.liquidationPrice(33_333333L, true, 3, 8000)).isEqualTo(24_444444L);
        }
    }

    @Nested
    @DisplayName("P&L")
    class Pnl {

        @Test
        @DisplayName("Long gains when price rises, short loses the same amount")
        void sign() {
            long qty = TradeMath.quantity(10, 1, 1);

            assertThat(TradeMath.pnl(true, qty, 100_000000L, 105_000000L)).isEqualTo(50_000000L);
            assertThat(TradeMath.pnl(false, qty, 100_000000L, 105_000000L)).isEqualTo(-50_000000L);
        }

        @Test
        @DisplayName("Fractions truncate toward zero on both sides")
        void truncatesTowardZero() {
            long qty = TradeMath.quantity(1, 1, 3);

            assertThat(qty).isEqualTo(333_333L);
            assertThat(TradeMath.pnl(true, qty, 100_000000L, 100_000005L)).isEqualTo(1L);
            assertThat(TradeMath.pnl(true, qty, 100_000005L, 100_000000L)).isEqualTo(-1L);
        }

        @Test
        @DisplayName("Capping clamps to plus or minus the margin")
        void cap() {
            assertThat(TradeMath.capToMargin(300_000000L, 100_000000L)).isEqualTo(100_000000L);
            assertThat(TradeMath.capToMargin(-300_000000L, 100_000000L)).isEqualTo(-100_000000L);
            assertThat(TradeMath.capToMargin(-5L, 100_000000L)).isEqualTo(-5L);
        }
    }

    @Nested
    @DisplayName("Spread and funding")
    class SpreadAndFunding {

        @Test
        @DisplayName("Entry pays the half spread on either side")
        void entry() {
            assertThat(TradeMath.entryPrice(100_000000L, true, 100000L)).isEqualTo(100_100000L);
            assertThat(TradeMath.entryPrice(100_000000L, false, 100000L)).isEqualTo(99_900000L);
        }

        @Test
        @DisplayName("A short entry that the spread drives to zero fails INVALID_PRICE")
        void nonPositiveEntry() {
            assertThatThrownBy(() -> TradeMath.entryPrice(100000L, false, 100000L))
                    .extracting("errorCode").isEqualTo(ErrorCode.INVALID_PRICE);
        }

        @Test
        @DisplayName("Exit applies the spread against the trader and funding by side")
        void exit() {
            assertThat(TradeMath.exitPrice(100_000000L, true, 100000L, 40000L)).isEqualTo(99_940000L);
            assertThat(TradeMath.exitPrice(100_000000L, false, 100000L, 40000L)).isEqualTo(100_060000L);
        }

        @Test
        @DisplayName("Exit price never goes below zero")
        void exitFloor() {
            assertThat(TradeMath.exitPrice(50000L, true, 100000L, 0)).isZero();
        }

        @Test
        @DisplayName("Funding counts whole intervals only")
        void wholeIntervals() {
            assertThat(TradeMath.funding(2699, 2700, 20000L)).isZero();
            assertThat(TradeMath.funding(5500, 2700, 20000L)).isEqualTo(40000L);
            assertThat(TradeMath.funding(5500, 2700, -20000L)).isEqualTo(-40000L);
        }
    }

    @Test
    @DisplayName("Tolerance band is inclusive at exactly 5 bps")
    void toleranceBoundary() {
        assertThat(TradeMath.withinTolerance(100_050000L, 100_000000L, 5)).isTrue();
        assertThat(TradeMath.withinTolerance(99_950000L, 100_000000L, 5)).isTrue();
        assertThat(TradeMath.withinTolerance(100_050001L, 100_000000L, 5)).isFalse();
    }
}
