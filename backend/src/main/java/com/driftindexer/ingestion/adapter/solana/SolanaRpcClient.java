package com.driftindexer.ingestion.adapter.solana;

import reactor.core.publisher.Mono;

/**
 * Raw Solana JSON-RPC transport: posts one request to {@code endpointUrl} and emits the response body.
 * Retries, rate limiting and endpoint choice belong to the caller.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
