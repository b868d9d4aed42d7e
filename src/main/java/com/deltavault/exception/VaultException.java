package com.deltavault.exception;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure of a vault operation. Every instance aborts the whole call: the vault has
 * already replayed its compensations by the time one reaches the caller.
 *
 * <p>One factory per taxonomy entry keeps messages and detail keys consistent across
 * call sites and tests.
 */
public class VaultException extends BaseException {

    public VaultException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public VaultException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public static VaultException zeroAmount(String argument) {
        return new VaultException(ErrorCode.ZERO_AMOUNT, argument + " must be greater than zero",
                Map.of("argument", argument));
    }

    public static VaultException zeroAddress(String argument) {
        return new VaultException(ErrorCode.ZERO_ADDRESS, argument + " must not be empty",
                Map.of("argument", argument));
    }

    public static VaultException depositTooSmall(BigInteger assets, BigInteger minDeposit) {
        return new VaultException(ErrorCode.DEPOSIT_TOO_SMALL,
                "Deposit of " + assets + " is below the minimum of " + minDeposit,
                Map.of("assets", assets, "minDeposit", minDeposit));
    }

    public static VaultException strategyNotSet() {
        return new VaultException(ErrorCode.STRATEGY_NOT_SET, "Spot and perp strategies must both be set");
    }

    public static VaultException positionManagerNotSet() {
        return new VaultException(ErrorCode.POSITION_MANAGER_NOT_SET, "Position manager is not set");
    }

    public static VaultException insufficientBalance(String subject, BigInteger requested, BigInteger available) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("subject", subject);
        details.put("requested", requested);
        details.put("available", available);
        return new VaultException(ErrorCode.INSUFFICIENT_BALANCE,
                "Insufficient " + subject + ": requested " + requested + ", available " + available, details);
    }

    public static VaultException strategyDepositFailed(String strategy, BigInteger requested, BigInteger accepted) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("strategy", strategy);
        details.put("requested", requested);
        details.put("accepted", accepted);
        return new VaultException(ErrorCode.STRATEGY_DEPOSIT_FAILED,
                "Strategy " + strategy + " accepted " + accepted + " of " + requested, details);
    }

    public static VaultException vaultPaused() {
        return new VaultException(ErrorCode.VAULT_PAUSED, "Vault is paused");
    }

    public static VaultException rebalanceNotNeeded() {
        return new VaultException(ErrorCode.REBALANCE_NOT_NEEDED, "Position manager reports no rebalance needed");
    }

    public static VaultException notOwner(String caller) {
        return new VaultException(ErrorCode.NOT_OWNER, "Caller " + caller + " is not the vault owner",
                Map.of("caller", String.valueOf(caller)));
    }

    public static VaultException reentrantCall(String operation, String inFlight) {
        return new VaultException(ErrorCode.REENTRANT_CALL,
                "Cannot run " + operation + " while " + inFlight + " is in flight",
                Map.of("operation", operation, "inFlight", inFlight));
    }
}
