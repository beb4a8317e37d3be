package com.rebalanceradar.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport abstraction for testing and endpoint rotation.
 * Retries and rotation are handled by {@link EvmRpcGateway}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      method params (e.g. filter object)
     * @return response body as string (JSON); errors with RpcException on transport failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
