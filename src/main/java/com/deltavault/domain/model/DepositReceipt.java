package com.deltavault.domain.model;

import java.math.BigInteger;

/** Outcome of a committed deposit. */
public record DepositReceipt(String account, BigInteger assets, BigInteger shares) {}
