package com.deltavault.asset;

import java.math.BigInteger;

/**
 * Transfer primitive for the vault's base asset. Implementations move real tokens; the
 * vault only tracks how much of its custody is idle versus deployed.
 */
public interface BaseAssetGateway {

    /**
     * Pulls {@code amount} from {@code from} into vault custody. Fails without moving
     * anything if the account cannot cover it.
     */
    void collect(String from, BigInteger amount);

    /** Pays {@code amount} out of vault custody to {@code to}. */
    void release(String to, BigInteger amount);

    BigInteger balanceOf(String account);
}
