package com.marginledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Six-decimal stablecoin amount for deposits, withdrawals and pool provision. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmountRequest {

    @NotNull(message = "Amount is required")
    private Long amount;
}
