package com.di.qualitygate.config;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt {@code n} (1-based) waits {@code base * 2^(n-1)}, capped at {@code maxDelay}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            maxDelay = baseDelay;
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /** Delay to wait after failed attempt {@code attempt} (1-based) before the next one. */
    public Duration delayAfterAttempt(int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 30));
        long millis = baseDelay.toMillis() * (1L << shift);
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }
}
