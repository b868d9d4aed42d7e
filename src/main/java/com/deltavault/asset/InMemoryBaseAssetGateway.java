package com.deltavault.asset;

import com.deltavault.exception.VaultException;
import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base-asset ledger kept in memory for depositor accounts. Vault custody is not modelled
 * here: the vault's idle balance plus its strategies' balances is the authority on what
 * it holds, and simulated strategies mint their yield without a counterparty.
 *
 * <p>Used by the simulator and by tests; a production deployment replaces it with a
 * gateway backed by the real token.
 */
public class InMemoryBaseAssetGateway implements BaseAssetGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBaseAssetGateway.class);

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();

    /** Credits {@code amount} to an account out of thin air. */
    public synchronized void fund(String account, BigInteger amount) {
        if (account == null || account.isBlank()) {
            throw VaultException.zeroAddress("account");
        }
        if (amount == null || amount.signum() <= 0) {
            throw VaultException.zeroAmount("amount");
        }
        balances.merge(account, amount, BigInteger::add);
        log.info("Funded account {} with {}", account, amount);
    }

    @Override
    public synchronized void collect(String from, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw VaultException.insufficientBalance("base asset", amount, balance);
        }
        setBalance(from, balance.subtract(amount));
    }

    @Override
    public synchronized void release(String to, BigInteger amount) {
        if (to == null || to.isBlank()) {
            throw VaultException.zeroAddress("to");
        }
        balances.merge(to, amount, BigInteger::add);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    private void setBalance(String account, BigInteger balance) {
        if (balance.signum() == 0) {
            balances.remove(account);
        } else {
            balances.put(account, balance);
        }
    }
}
