package com.deltavault.strategy;

import java.math.BigInteger;

/**
 * Contract for a pluggable yield strategy that holds one leg of the vault's capital.
 *
 * <p>Concrete adapters (lending markets, perpetual-futures venues) live outside the vault
 * core. The vault relies on the following obligations and verifies the first two on
 * every call, since an adapter is untrusted code:
 * <ul>
 *   <li>{@link #deposit} accepts the full requested amount or fails the whole call</li>
 *   <li>{@link #withdraw} returns exactly the requested amount or fails the whole call</li>
 *   <li>{@link #totalAssets} never decreases between calls absent a withdraw (yield only
 *       accrues upward) and reflects a deposit/withdraw as soon as that call returns</li>
 * </ul>
 *
 * <p>Any of these calls may call back into the vault. Mutating vault entry points reject
 * such callbacks; read-only ones answer them.
 */
public interface StrategyAdapter {

    /** Display name used in logs, events and the collaborator registry. */
    String getName();

    /**
     * Deploys {@code amount} base-asset units into the strategy.
     *
     * @return the amount the strategy actually accepted
     */
    BigInteger deposit(BigInteger amount);

    /**
     * Pulls {@code amount} base-asset units back out of the strategy.
     *
     * @return the amount actually returned to the vault
     */
    BigInteger withdraw(BigInteger amount);

    /** Live valuation of everything this strategy holds for the vault, yield included. */
    BigInteger totalAssets();
}
