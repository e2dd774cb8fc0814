package com.lendguard.pricing;

/**
 * Typed read access to the price oracle contract. Implementations bound each call by a timeout and raise
 * {@link com.lendguard.common.RiskEngineException} with NETWORK_TIMEOUT or CHAIN_READ_FAILED on failure.
 */
public interface OracleReader {

    /**
     * @param assetId oracle pair identifier (felt, decimal or 0x-hex string)
     */
    OracleResponse query(String assetId, AggregationMode mode);
}
