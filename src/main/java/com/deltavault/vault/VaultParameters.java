package com.deltavault.vault;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Data;

/**
 * Construction-time parameters of a vault instance, loaded from
 * {@code deltavault.vault.*} by VaultConfig.
 */
@Data
@Builder
public class VaultParameters {

    /** Account allowed to run administrative operations until ownership is transferred. */
    private String owner;

    /** Dust floor: smallest accepted deposit, in base-asset units. */
    private BigInteger minDeposit;

    /** Fixed-point scale applied to intermediate products in the proportional withdrawal. */
    private BigInteger precision;

    /**
     * Delta tolerance in basis points of deployed capital. Read by position managers,
     * never by the vault itself.
     */
    private int maxDeltaToleranceBps;
}
