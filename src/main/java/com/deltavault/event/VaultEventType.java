package com.deltavault.event;

/**
 * Classifies a {@link VaultEvent}. The first four mirror the vault's public event log;
 * the rest record administrative and share-token changes.
 */
public enum VaultEventType {

    /** Shares minted against a deposit. Details: owner, assets, shares. */
    DEPOSIT,

    /** Shares burned and assets paid out. Details: owner, assets, shares. */
    WITHDRAW,

    /** Rebalance requested from the position manager. Details: oldDelta, newDelta, sizing. */
    REBALANCE,

    /** Pause flag changed. Details: paused. */
    EMERGENCY_PAUSE,

    /** Shares moved between holders. Details: from, to, shares. */
    SHARES_TRANSFERRED,

    /** Spot or perp strategy handle replaced. Details: leg, strategy. */
    STRATEGY_UPDATED,

    /** Position manager handle replaced. Details: positionManager. */
    POSITION_MANAGER_UPDATED,

    OWNERSHIP_TRANSFERRED
}
