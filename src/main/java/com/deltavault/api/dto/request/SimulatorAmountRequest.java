package com.deltavault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.Data;

/** Simulator call: {@code name} is a strategy name for yield/loss, an account for funding. */
@Data
public class SimulatorAmountRequest {

    @NotBlank
    private String name;

    @NotNull
    private BigInteger amount;
}
