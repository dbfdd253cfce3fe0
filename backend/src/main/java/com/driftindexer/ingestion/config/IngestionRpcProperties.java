package com.driftindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Solana RPC endpoints and local throttling.
 */
@ConfigurationProperties(prefix = "driftindexer.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionRpcProperties {

    public static final String SOLANA_MAINNET_RPC = "https://api.mainnet-beta.solana.com";

    private List<String> urls = new ArrayList<>(List.of(SOLANA_MAINNET_RPC));

    /** Request budget shared by all pollers of this instance. */
    @Min(1)
    private int maxRequestsPerSecond = 10;

    /** How long a call may wait for a limiter permit before failing. */
    private long limiterTimeoutMs = 5_000;

    /** Per-request HTTP timeout. */
    private long requestTimeoutMs = 30_000;

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }
}
