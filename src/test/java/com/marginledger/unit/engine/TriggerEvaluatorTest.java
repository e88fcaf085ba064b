package com.marginledger.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marginledger.config.EngineProperties;
import com.marginledger.domain.enums.CloseReason;
import com.marginledger.engine.TriggerEvaluator;
import com.marginledger.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TriggerEvaluatorTest {

    private TriggerEvaluator triggerEvaluator;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.setToleranceBps(5);
        triggerEvaluator = new TriggerEvaluator(properties);
    }

    @Nested
    @DisplayName("Stop-loss and take-profit")
    class Stops {

        @Test
        @DisplayName("Fire only within the tolerance band, on either side of the trigger")
        void toleranceOnly() {
            assertThat(triggerEvaluator.accepts(CloseReason.STOP_LOSS, true, 95_000000L, 95_047500L)).isTrue();
            assertThat(triggerEvaluator.accepts(CloseReason.STOP_LOSS, true, 95_000000L, 94_952500L)).isTrue();
            assertThat(triggerEvaluator.accepts(CloseReason.STOP_LOSS, true, 95_000000L, 90_000000L)).isFalse();
            assertThat(triggerEvaluator.accepts(CloseReason.TAKE_PROFIT, true, 110_000000L, 120_000000L)).isFalse();
        }

        @Test
        @DisplayName("An unset trigger fails TRIGGER_NOT_SET before the price is considered")
        void unset() {
            assertThatThrownBy(() -> triggerEvaluator.check(
                            CloseReason.TAKE_PROFIT, true, 95_000000L, 0, 92_000000L, 110_000000L))
                    .extracting("errorCode").isEqualTo(ErrorCode.TRIGGER_NOT_SET);
        }

        @Test
        @DisplayName("A price outside the band fails PRICE_NOT_NEAR")
        void farPrice() {
            assertThatThrownBy(() -> triggerEvaluator.check(
                            CloseReason.STOP_LOSS, true, 95_000000L, 0, 92_000000L, 97_000000L))
                    .extracting("errorCode").isEqualTo(ErrorCode.PRICE_NOT_NEAR);
        }
    }

    @Nested
    @DisplayName("Liquidation")
    class Liquidation {

        @Test
        @DisplayName("Long fires near the trigger or anywhere below it")
        void longSide() {
            assertThat(triggerEvaluator.accepts(CloseReason.LIQUIDATION, true, 90_000000L, 90_045000L)).isTrue();
            assertThat(triggerEvaluator.accepts(CloseReason.LIQUIDATION, true, 90_000000L, 85_000000L)).isTrue();
            assertThat(triggerEvaluator.accepts(CloseReason.LIQUIDATION, true, 90_000000L, 95_000000L)).isFalse();
        }

        @Test
        @DisplayName("Short fires near the trigger or anywhere above it")
        void shortSide() {
            assertThat(triggerEvaluator.accepts(CloseReason.LIQUIDATION, false, 108_000000L, 120_000000L)).isTrue();
            assertThat(triggerEvaluator.accepts(CloseReason.LIQUIDATION, false, 108_000000L, 100_000000L)).isFalse();
            assertThatCode(() -> triggerEvaluator.check(
                            CloseReason.LIQUIDATION, false, 0, 0, 108_000000L, 130_000000L))
                    .doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("MARKET is not a trigger")
    void marketRejected() {
        assertThatThrownBy(() -> triggerEvaluator.check(CloseReason.MARKET, true, 0, 0, 92_000000L, 92_000000L))
                .extracting("errorCode").isEqualTo(ErrorCode.BAD_REQUEST);
    }
}
