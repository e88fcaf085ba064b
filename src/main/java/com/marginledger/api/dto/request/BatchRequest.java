package com.marginledger.api.dto.request;

import com.marginledger.domain.enums.CloseReason;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for keeper batches. {@code reason} is only read by the close batch.
 * One proof is used for every id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRequest {

    @NotNull(message = "Asset id is required")
    private Integer assetId;

    private CloseReason reason;

    @NotEmpty(message = "At least one trade id is required")
    private List<@NotNull Long> tradeIds;

    @NotBlank(message = "Price proof is required")
    private String proof;
}
