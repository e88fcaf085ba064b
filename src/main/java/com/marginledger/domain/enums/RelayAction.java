package com.marginledger.domain.enums;

import java.util.Set;

/** Engine entry points reachable through a signed delegated call, with the parameters each accepts. */
public enum RelayAction {
    OPEN_LIMIT(Set.of("assetId", "long", "leverage", "lots", "targetPrice", "stopLoss", "takeProfit")),
    OPEN_MARKET(Set.of("assetId", "long", "leverage", "lots", "stopLoss", "takeProfit", "proof")),
    CANCEL(Set.of("tradeId")),
    CLOSE_MARKET(Set.of("tradeId", "proof")),
    UPDATE_STOPS(Set.of("tradeId", "stopLoss", "takeProfit"));

    private final Set<String> parameterNames;

    RelayAction(Set<String> parameterNames) {
        this.parameterNames = parameterNames;
    }

    public Set<String> getParameterNames() {
        return parameterNames;
    }

    public boolean accepts(String parameterName) {
        return parameterNames.contains(parameterName);
    }
}
