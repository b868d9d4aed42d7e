package com.deltavault.vault;

import com.deltavault.exception.VaultException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Fungible balance book for vault shares.
 *
 * <p>Accounts whose balance reaches zero are removed, so an empty ledger has a total
 * supply of zero and no holders, and the sum of all balances always equals the total
 * supply once a method returns.
 */
public class ShareLedger {

    private final Map<String, BigInteger> balances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public synchronized void mint(String to, BigInteger shares) {
        requirePositive(shares);
        balances.merge(to, shares, BigInteger::add);
        totalSupply = totalSupply.add(shares);
    }

    public synchronized void burn(String from, BigInteger shares) {
        requirePositive(shares);
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(shares) < 0) {
            throw VaultException.insufficientBalance("shares", shares, balance);
        }
        setBalance(from, balance.subtract(shares));
        totalSupply = totalSupply.subtract(shares);
    }

    public synchronized void transfer(String from, String to, BigInteger shares) {
        requirePositive(shares);
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(shares) < 0) {
            throw VaultException.insufficientBalance("shares", shares, balance);
        }
        setBalance(from, balance.subtract(shares));
        balances.merge(to, shares, BigInteger::add);
    }

    public synchronized BigInteger balanceOf(String owner) {
        return balances.getOrDefault(owner, BigInteger.ZERO);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    /** Point-in-time copy of every nonzero balance. */
    public synchronized Map<String, BigInteger> holders() {
        return Collections.unmodifiableMap(new HashMap<>(balances));
    }

    private void setBalance(String owner, BigInteger balance) {
        if (balance.signum() == 0) {
            balances.remove(owner);
        } else {
            balances.put(owner, balance);
        }
    }

    private static void requirePositive(BigInteger shares) {
        if (shares == null || shares.signum() <= 0) {
            throw VaultException.zeroAmount("shares");
        }
    }
}
