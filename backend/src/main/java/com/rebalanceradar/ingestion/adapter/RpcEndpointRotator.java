package com.rebalanceradar.ingestion.adapter;

import com.rebalanceradar.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin RPC endpoint selection with retry delay (exponential backoff ± jitter).
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    /**
     * Next endpoint in round-robin order.
     */
    public String getNextEndpoint() {
        int i = Math.floorMod(index.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
