package com.lendguard.pool;

import java.math.BigInteger;

/**
 * On-chain pool totals in the debt asset's smallest unit.
 */
public record PoolChainState(BigInteger totalSupplied, BigInteger totalBorrowed) {
}
