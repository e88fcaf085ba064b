package com.marginledger.api.dto.request;

import com.marginledger.domain.enums.RelayAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A trader-signed call submitted by a relayer. Parameter values are strings; proofs are
 * base64 under the {@code proof} key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DelegatedCallRequest {

    @NotBlank(message = "Trader is required")
    private String trader;

    @NotNull(message = "Action is required")
    private RelayAction action;

    private Map<String, String> parameters;

    @NotNull(message = "Nonce is required")
    private Long nonce;

    @NotNull(message = "Expiry is required")
    private Long expiresAt;

    @NotBlank(message = "Signature is required")
    private String signature;
}
