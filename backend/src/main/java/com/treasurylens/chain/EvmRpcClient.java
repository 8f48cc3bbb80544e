package com.treasurylens.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Endpoint selection and fallback are handled by {@link ContractReader}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call"
     * @param params      method params
     * @return response body as string (JSON); errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
