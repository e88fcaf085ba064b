package com.marginledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for opening a position at the price carried by {@code proof} (base64). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenMarketRequest {

    @NotNull(message = "Asset id is required")
    private Integer assetId;

    @NotNull(message = "Side is required")
    private Boolean longSide;

    @NotNull(message = "Leverage is required")
    private Integer leverage;

    @NotNull(message = "Lots are required")
    private Long lots;

    private long stopLoss;

    private long takeProfit;

    @NotBlank(message = "Price proof is required")
    private String proof;
}
