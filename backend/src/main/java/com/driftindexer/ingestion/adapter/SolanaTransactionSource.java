package com.driftindexer.ingestion.adapter;

import com.driftindexer.ingestion.adapter.solana.SolanaRpcClient;
import com.driftindexer.ingestion.adapter.solana.SolanaTransactionDecoder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Solana JSON-RPC transaction source: getSignaturesForAddress for listings, getTransaction (base64 wire format)
 * for bodies. Every call goes through the local rate limiter and is retried over the rotated endpoints.
 */
@Component
@Slf4j
public class SolanaTransactionSource implements TransactionSource {

    static final String GET_SIGNATURES_FOR_ADDRESS = "getSignaturesForAddress";
    static final String GET_TRANSACTION = "getTransaction";
    private static final String COMMITMENT = "finalized";

    private final SolanaRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final SolanaTransactionDecoder transactionDecoder;

    public SolanaTransactionSource(SolanaRpcClient rpcClient,
                                   RpcEndpointRotator rotator,
                                   @Qualifier("solanaRpcRateLimiter") RateLimiter rateLimiter,
                                   ObjectMapper objectMapper,
                                   SolanaTransactionDecoder transactionDecoder) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.transactionDecoder = transactionDecoder;
    }

    @Override
    public List<SignatureInfo> listSignatures(String account, int limit, String untilSignature) {
        Map<String, Object> config = new HashMap<>();
        config.put("limit", limit);
        config.put("commitment", COMMITMENT);
        if (untilSignature != null) {
            config.put("until", untilSignature);
        }
        JsonNode result = callWithRetry(GET_SIGNATURES_FOR_ADDRESS, List.of(account, config));
        if (!result.isArray()) {
            throw new SourceUnavailableException(GET_SIGNATURES_FOR_ADDRESS + " for " + account + " returned no signature list: " + result);
        }
        List<SignatureInfo> infos = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            JsonNode blockTime = node.path("blockTime");
            infos.add(new SignatureInfo(
                    node.path("signature").asText(),
                    node.path("slot").asLong(),
                    !node.path("err").isMissingNode() && !node.path("err").isNull(),
                    blockTime.isNumber() ? blockTime.asLong() : null));
        }
        return infos;
    }

    @Override
    public Optional<FetchedTransaction> getTransaction(String signature) {
        Map<String, Object> config = Map.of(
                "encoding", "base64",
                "maxSupportedTransactionVersion", 0,
                "commitment", COMMITMENT);
        JsonNode result = callWithRetry(GET_TRANSACTION, List.of(signature, config));
        if (result.isNull() || result.isMissingNode()) {
            return Optional.empty();
        }
        // base64 encoding yields ["<payload>", "base64"]
        JsonNode body = result.path("transaction");
        if (!body.isArray() || body.isEmpty() || !body.get(0).isTextual()) {
            throw new UnsupportedTransactionEncodingException("Transaction " + signature + " is not base64 encoded");
        }
        byte[] wire;
        try {
            wire = Base64.getDecoder().decode(body.get(0).asText());
        } catch (IllegalArgumentException e) {
            throw new UnsupportedTransactionEncodingException("Transaction " + signature + " has invalid base64 body", e);
        }
        List<String> accountKeys = transactionDecoder.staticAccountKeys(wire);
        List<String> logs = new ArrayList<>();
        JsonNode logMessages = result.path("meta").path("logMessages");
        if (logMessages.isArray()) {
            logMessages.forEach(line -> logs.add(line.asText()));
        }
        return Optional.of(new FetchedTransaction(signature, result.path("slot").asLong(), accountKeys, logs));
    }

    private JsonNode callWithRetry(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(method, attempt - 1);
            }
            String endpoint = rotator.nextEndpoint();
            try {
                return call(endpoint, method, params);
            } catch (SourceUnavailableException | JsonProcessingException e) {
                lastException = e;
                log.debug("{} attempt {} on {} failed: {}", method, attempt + 1, endpoint, e.getMessage());
            }
        }
        throw new SourceUnavailableException(method + " failed after " + rotator.getMaxAttempts() + " attempt(s)", lastException);
    }

    private JsonNode call(String endpoint, String method, Object params) throws JsonProcessingException {
        if (!rateLimiter.acquirePermission()) {
            throw new SourceUnavailableException("Local RPC limiter timeout before " + method + " on " + endpoint);
        }
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new SourceUnavailableException(method + " returned an empty body from " + endpoint);
        }
        JsonNode root = objectMapper.readTree(json);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new SourceUnavailableException(method + " error from " + endpoint + ": " + error);
        }
        return root.path("result");
    }

    private void sleepBeforeRetry(String method, int retry) {
        try {
            Thread.sleep(rotator.retryDelayMs(retry));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while retrying " + method, e);
        }
    }
}
