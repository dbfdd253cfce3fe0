package com.driftindexer.ingestion.adapter;

import com.driftindexer.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin over the configured Solana RPC endpoints, paired with the retry policy that paces fail-over.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger next = new AtomicInteger();
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one RPC endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String nextEndpoint() {
        return endpoints.get(Math.floorMod(next.getAndIncrement(), endpoints.size()));
    }

    public long retryDelayMs(int retry) {
        return retryPolicy.delayMs(retry);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
