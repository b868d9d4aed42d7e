package com.deltavault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.Data;

@Data
public class TransferSharesRequest {

    @NotBlank
    private String account;

    @NotBlank
    private String to;

    @NotNull
    private BigInteger shares;
}
