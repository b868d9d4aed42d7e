package com.deltavault.simulator;

import com.deltavault.exception.VaultException;
import com.deltavault.strategy.StrategyAdapter;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory strategy leg that honours the adapter contract exactly: deposits are
 * accepted in full, withdrawals return the exact amount or fail without moving anything.
 *
 * <p>Yield and losses are injected by hand ({@link #accrueYield}, {@link #realizeLoss})
 * so share-price behaviour can be exercised without a live protocol.
 */
public class SimulatedStrategyAdapter implements StrategyAdapter {

    private static final Logger log = LoggerFactory.getLogger(SimulatedStrategyAdapter.class);

    private final String name;
    private BigInteger balance = BigInteger.ZERO;

    public SimulatedStrategyAdapter(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized BigInteger deposit(BigInteger amount) {
        requirePositive(amount);
        balance = balance.add(amount);
        log.debug("{}: accepted {}, balance={}", name, amount, balance);
        return amount;
    }

    @Override
    public synchronized BigInteger withdraw(BigInteger amount) {
        requirePositive(amount);
        if (balance.compareTo(amount) < 0) {
            throw VaultException.insufficientBalance(name + " balance", amount, balance);
        }
        balance = balance.subtract(amount);
        log.debug("{}: returned {}, balance={}", name, amount, balance);
        return amount;
    }

    @Override
    public synchronized BigInteger totalAssets() {
        return balance;
    }

    public synchronized void accrueYield(BigInteger amount) {
        requirePositive(amount);
        balance = balance.add(amount);
        log.info("{}: accrued yield {}, balance={}", name, amount, balance);
    }

    /** Writes down the balance, never below zero. */
    public synchronized void realizeLoss(BigInteger amount) {
        requirePositive(amount);
        BigInteger loss = amount.min(balance);
        balance = balance.subtract(loss);
        log.warn("{}: realized loss {}, balance={}", name, loss, balance);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw VaultException.zeroAmount("amount");
        }
    }
}
