package com.marginledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayKeyRequest {

    @NotBlank(message = "Signing key is required")
    @Size(min = 16, max = 128, message = "Signing key must be 16 to 128 characters")
    private String signingKey;
}
