package com.marginledger.engine;

import com.marginledger.config.EngineProperties;
import com.marginledger.domain.enums.CloseReason;
import com.marginledger.exception.BusinessException;
import com.marginledger.exception.ErrorCode;
import org.springframework.stereotype.Component;

/**
 * Decides whether an observed price fires a stored trigger.
 *
 * <p>Stop-loss and take-profit fire when the price is within the tolerance band of the
 * trigger. Liquidation also fires once the price has moved past the liquidation price in
 * the adverse direction, so a position that gaps through its liquidation level can still
 * be closed.
 */
@Component
public class TriggerEvaluator {

    private final EngineProperties engineProperties;

    public TriggerEvaluator(EngineProperties engineProperties) {
        this.engineProperties = engineProperties;
    }

    /**
     * @throws BusinessException TRIGGER_NOT_SET if the trigger for {@code reason} is zero,
     *     PRICE_NOT_NEAR if the price does not fire it
     */
    public void check(CloseReason reason, boolean longSide, long stopLoss, long takeProfit, long liquidationPrice, long price) {
        long trigger = triggerFor(reason, stopLoss, takeProfit, liquidationPrice);
        if (trigger == 0) {
            throw new BusinessException(ErrorCode.TRIGGER_NOT_SET, reason + " trigger is not set");
        }
        if (!accepts(reason, longSide, trigger, price)) {
            throw new BusinessException(
                    ErrorCode.PRICE_NOT_NEAR,
                    String.format("Price %d does not fire %s trigger %d", price, reason, trigger));
        }
    }

    public boolean accepts(CloseReason reason, boolean longSide, long trigger, long price) {
        if (TradeMath.withinTolerance(price, trigger, engineProperties.getToleranceBps())) {
            return true;
        }
        if (reason == CloseReason.LIQUIDATION) {
            return longSide ? price <= trigger : price >= trigger;
        }
        return false;
    }

    private static long triggerFor(CloseReason reason, long stopLoss, long takeProfit, long liquidationPrice) {
        return switch (reason) {
            case STOP_LOSS -> stopLoss;
            case TAKE_PROFIT -> takeProfit;
            case LIQUIDATION -> liquidationPrice;
            case MARKET -> throw new BusinessException(ErrorCode.BAD_REQUEST, reason + " is not a trigger close");
        };
    }
}
