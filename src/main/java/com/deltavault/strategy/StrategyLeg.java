package com.deltavault.strategy;

/**
 * The two capital legs of the vault. SPOT holds the long asset exposure, PERP holds the
 * offsetting perpetual-futures hedge.
 */
public enum StrategyLeg {
    SPOT,
    PERP
}
