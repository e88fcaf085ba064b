package com.marginledger.api.dto.request;

import com.marginledger.domain.enums.LedgerRole;
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
public class RoleGrantRequest {

    @NotBlank(message = "Account id is required")
    private String accountId;

    @NotNull(message = "Role is required")
    private LedgerRole role;
}
