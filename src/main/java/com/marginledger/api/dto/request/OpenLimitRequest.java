package com.marginledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for placing a limit order. Prices are six-decimal integers
 * (100.5 is 100500000); zero or absent stop levels are not set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenLimitRequest {

    @NotNull(message = "Asset id is required")
    private Integer assetId;

    @NotNull(message = "Side is required")
    private Boolean longSide;

    @NotNull(message = "Leverage is required")
    private Integer leverage;

    @NotNull(message = "Lots are required")
    private Long lots;

    @NotNull(message = "Target price is required")
    private Long targetPrice;

    private long stopLoss;

    private long takeProfit;
}
