package com.deltavault.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Data;

/**
 * Read-only view of a vault at one instant, assembled without taking the vault's
 * reentrancy lock.
 */
@Data
@Builder
public class VaultSnapshot {

    private String owner;
    private boolean paused;

    private BigInteger idleAssets;

    /** Null when the spot strategy is unset. */
    private BigInteger spotAssets;

    /** Null when the perp strategy is unset. */
    private BigInteger perpAssets;

    private BigInteger totalAssets;
    private BigInteger totalShares;

    /** Zero when no position manager is set. */
    private BigInteger currentDelta;

    private String spotStrategy;
    private String perpStrategy;
    private String positionManager;
}
