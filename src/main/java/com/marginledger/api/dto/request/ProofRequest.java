package com.marginledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProofRequest {

    /** Base64 price proof. */
    @NotBlank(message = "Price proof is required")
    private String proof;
}
