package com.lendguard.chain;

import reactor.core.publisher.Mono;

/**
 * Starknet JSON-RPC client abstraction. Retries, endpoint rotation and timeouts are handled by
 * {@link StarknetChainAdapter}.
 */
public interface StarknetRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "starknet_call"
     * @param params      method params
     * @return response body (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
