package com.lendguard.pool;

/**
 * Typed read access to lending pool contracts.
 */
public interface PoolReader {

    PoolChainState readPool(String poolAddress);
}
