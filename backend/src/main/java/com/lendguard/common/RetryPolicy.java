package com.lendguard.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter for chain RPC retries.
 * Attempt 0 waits {@code baseDelay}, attempt n waits {@code baseDelay * 2^n}, both capped at {@code maxDelay}.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 20;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor, int maxAttempts) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (jitterFactor < 0 || jitterFactor >= 1) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay != null ? maxDelay : Duration.ofMinutes(1);
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the retry that follows the given zero-based failed attempt.
     */
    public Duration delayFor(int attempt) {
        long base = baseDelay.toMillis();
        long exponential = attempt <= 0 ? base : base * (1L << Math.min(attempt, MAX_SHIFT));
        long capped = Math.min(exponential, maxDelay.toMillis());
        return Duration.ofMillis(applyJitter(capped));
    }

    private long applyJitter(long millis) {
        if (jitterFactor == 0) {
            return millis;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, Math.round(millis * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 500ms base, 10s cap, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(Duration.ofMillis(500), Duration.ofSeconds(10), 0.2, 3);
    }
}
