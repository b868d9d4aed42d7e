package com.deltavault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.Data;

@Data
public class WithdrawRequest {

    @NotBlank
    private String account;

    /** Shares to burn. */
    @NotNull
    private BigInteger shares;
}
