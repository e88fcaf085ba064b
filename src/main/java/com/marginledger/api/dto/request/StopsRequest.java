package com.marginledger.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** New stop levels; both are replaced, zero clears a level. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopsRequest {

    private long stopLoss;

    private long takeProfit;
}
