package com.rebalanceradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter and an upper bound. Shared by RPC endpoint retries and
 * ingestion queue redelivery.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Invalid delay bounds: base=" + baseDelayMs + " max=" + maxDelayMs);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then ±jitter, never above maxDelay.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return cap(jitter(baseDelayMs));
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return cap(jitter(Math.min(exponential, maxDelayMs)));
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    private long cap(long value) {
        return Math.min(value, maxDelayMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, 30s ceiling, ±20% jitter, 5 max attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 30_000L, 0.2, 5);
    }
}
