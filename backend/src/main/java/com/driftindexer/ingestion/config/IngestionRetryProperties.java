package com.driftindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * RPC retry policy (exponential backoff with jitter).
 */
@ConfigurationProperties(prefix = "driftindexer.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Delay before the first retry; doubles each further retry. */
    private long baseDelayMs = 500L;

    /** 0..1, e.g. 0.2 = ±20%. */
    private double jitterFactor = 0.2;

    /** Attempts per call including the first. */
    private int maxAttempts = 3;
}
