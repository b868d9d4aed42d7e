package com.deltavault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.Data;

@Data
public class DepositRequest {

    /** Depositor; receives the minted shares. */
    @NotBlank
    private String account;

    /** Base-asset units to deposit. Range checks are the vault's own. */
    @NotNull
    private BigInteger assets;
}
