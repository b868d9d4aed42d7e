package com.deltavault.position;

import java.math.BigInteger;

/**
 * Signed sizing returned by {@link PositionManager#calculateRebalanceAmounts()}.
 * Positive adds capital/exposure to a leg, negative removes it.
 */
public record RebalanceAmounts(BigInteger spotAdjustment, BigInteger perpAdjustment) {

    public static final RebalanceAmounts NONE = new RebalanceAmounts(BigInteger.ZERO, BigInteger.ZERO);

    public RebalanceAmounts {
        spotAdjustment = spotAdjustment != null ? spotAdjustment : BigInteger.ZERO;
        perpAdjustment = perpAdjustment != null ? perpAdjustment : BigInteger.ZERO;
    }

    public boolean isEmpty() {
        return spotAdjustment.signum() == 0 && perpAdjustment.signum() == 0;
    }
}
