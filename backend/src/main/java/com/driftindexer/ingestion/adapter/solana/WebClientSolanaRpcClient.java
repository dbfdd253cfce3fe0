package com.driftindexer.ingestion.adapter.solana;

import com.driftindexer.ingestion.adapter.SourceUnavailableException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 over HTTP POST using WebClient.
 */
public class WebClientSolanaRpcClient implements SolanaRpcClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientSolanaRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? params : List.of()
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new SourceUnavailableException(method + " HTTP " + e.getStatusCode().value() + " from " + endpointUrl, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new SourceUnavailableException(method + " request to " + endpointUrl + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new SourceUnavailableException(method + " timed out after " + timeout + " on " + endpointUrl, e));
    }
}
