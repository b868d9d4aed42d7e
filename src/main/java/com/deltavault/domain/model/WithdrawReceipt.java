package com.deltavault.domain.model;

import java.math.BigInteger;

/** Outcome of a committed withdrawal. */
public record WithdrawReceipt(String account, BigInteger shares, BigInteger assets) {}
