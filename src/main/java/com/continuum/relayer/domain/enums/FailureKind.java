package com.continuum.relayer.domain.enums;

/**
 * Classification of a failed execution attempt.
 * TRANSIENT failures (timeouts, congestion, rate limits) are retried by the RetryPolicy;
 * PERMANENT ones (bad parameters, insufficient funds, order gone) fail the order at once.
 */
public enum FailureKind {
    TRANSIENT,
    PERMANENT
}
