package com.deltavault.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", 405),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),

    // ---- Vault taxonomy ----
    ZERO_AMOUNT("ZERO_AMOUNT", 400),
    ZERO_ADDRESS("ZERO_ADDRESS", 400),
    DEPOSIT_TOO_SMALL("DEPOSIT_TOO_SMALL", 400),
    STRATEGY_NOT_SET("STRATEGY_NOT_SET", 409),
    POSITION_MANAGER_NOT_SET("POSITION_MANAGER_NOT_SET", 409),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", 422),
    STRATEGY_DEPOSIT_FAILED("STRATEGY_DEPOSIT_FAILED", 502),
    VAULT_PAUSED("VAULT_PAUSED", 423),
    REBALANCE_NOT_NEEDED("REBALANCE_NOT_NEEDED", 409),
    NOT_POSITION_MANAGER("NOT_POSITION_MANAGER", 403),
    NOT_OWNER("NOT_OWNER", 403),
    REENTRANT_CALL("REENTRANT_CALL", 409);

    private final String code;
    private final int httpStatus;
}
