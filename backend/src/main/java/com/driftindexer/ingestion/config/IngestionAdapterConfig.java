package com.driftindexer.ingestion.config;

import com.driftindexer.common.Base58;
import com.driftindexer.common.InvalidConfigurationException;
import com.driftindexer.common.RetryPolicy;
import com.driftindexer.domain.ProgramAddress;
import com.driftindexer.ingestion.adapter.RpcEndpointRotator;
import com.driftindexer.ingestion.adapter.solana.SolanaRpcClient;
import com.driftindexer.ingestion.adapter.solana.WebClientSolanaRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Solana RPC transport, endpoint rotation, local rate limiter and the indexed program address.
 */
@Configuration
@EnableConfigurationProperties({ IndexerProperties.class, IngestionRpcProperties.class, IngestionRetryProperties.class })
@Slf4j
public class IngestionAdapterConfig {

    @Bean
    public ProgramAddress programAddress(IndexerProperties properties) {
        String programId = properties.getProgramId().strip();
        if (!Base58.isValid(programId, 32)) {
            throw new InvalidConfigurationException("Invalid program id: " + programId);
        }
        return new ProgramAddress(programId);
    }

    @Bean
    public RpcEndpointRotator solanaRpcEndpointRotator(IngestionRpcProperties rpcProperties,
                                                       IngestionRetryProperties retryProperties) {
        if (rpcProperties.getUrls().isEmpty()) {
            throw new InvalidConfigurationException("driftindexer.rpc.urls must list at least one endpoint");
        }
        log.info("Using Solana RPC endpoint(s): {}", rpcProperties.getUrls());
        RetryPolicy retryPolicy = new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
        return new RpcEndpointRotator(rpcProperties.getUrls(), retryPolicy);
    }

    @Bean(name = "solanaRpcRateLimiter")
    public RateLimiter solanaRpcRateLimiter(IngestionRpcProperties rpcProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, rpcProperties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, IngestionRpcProperties rpcProperties) {
        return new WebClientSolanaRpcClient(webClientBuilder, Duration.ofMillis(rpcProperties.getRequestTimeoutMs()));
    }
}
