package com.continuum.relayer.oms;

import com.continuum.relayer.domain.model.ExecutionFailure;
import java.time.Duration;

/**
 * Decides whether a failed attempt is retried and how long to wait first.
 *
 * <p>Only transient failures are retried, and only while {@code attempts < maxAttempts}.
 * The delay grows as {@code baseDelay * multiplier^(attempts - 1)}, capped at {@code maxDelay};
 * a multiplier of 1.0 gives a fixed backoff.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
    }

    public boolean shouldRetry(int attempts, ExecutionFailure failure) {
        return failure.isTransient() && attempts < maxAttempts;
    }

    /** Backoff before the attempt that follows attempt number {@code attempts} (1-based). */
    public Duration delayFor(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        double millis = baseDelay.toMillis() * Math.pow(multiplier, exponent);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
