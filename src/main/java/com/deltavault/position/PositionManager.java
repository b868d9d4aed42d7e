package com.deltavault.position;

import java.math.BigInteger;

/**
 * Contract for the collaborator that measures the vault's net directional exposure
 * ("delta") and sizes rebalances.
 *
 * <p>Sign convention: positive delta is net long, negative is net short, zero is the
 * neutral target. The vault performs no delta math of its own; it treats this as an
 * opaque oracle and controller. The {@code MAX_DELTA_TOLERANCE} threshold is consumed
 * here, not by the vault.
 */
public interface PositionManager {

    String getName();

    boolean isRebalanceNeeded();

    BigInteger getCurrentDelta();

    RebalanceAmounts calculateRebalanceAmounts();

    /** Informs the manager of the split just deployed by a deposit. */
    void updatePosition(BigInteger spotAmount, BigInteger perpAmount);
}
