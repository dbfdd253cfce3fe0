package com.driftindexer.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter, applied between Solana RPC attempts.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Pause before retry number {@code retry} (0 = first retry): baseDelay * 2^retry, jittered.
     */
    public long delayMs(int retry) {
        int shift = Math.max(0, Math.min(retry, 20));
        return withJitter(baseDelayMs << shift);
    }

    private long withJitter(long delay) {
        if (jitterFactor == 0.0) {
            return delay;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0L, Math.round(delay * factor));
    }

    /** Total attempts including the initial call. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 500 ms base, ±20% jitter, 3 attempts. Kept short so a failing endpoint aborts the tick
     * well before the next one is due.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }
}
