package com.marginledger.api.dto.request;

import com.marginledger.domain.enums.CloseReason;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerCloseRequest {

    /** STOP_LOSS, TAKE_PROFIT or LIQUIDATION. */
    @NotNull(message = "Close reason is required")
    private CloseReason reason;

    @NotBlank(message = "Price proof is required")
    private String proof;
}
