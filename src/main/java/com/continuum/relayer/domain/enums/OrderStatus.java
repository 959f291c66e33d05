package com.continuum.relayer.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Relayer-side lifecycle of an order.
 *
 * <pre>
 * PENDING   -> EXECUTING   engine claims the order
 * EXECUTING -> EXECUTED    ledger confirmed the execution
 * EXECUTING -> PENDING     attempt failed, retries remain (re-enqueued after backoff)
 * EXECUTING -> FAILED      attempt failed, retries exhausted or failure is permanent
 * PENDING   -> CANCELLED   user cancellation, only before the engine claims the order
 * </pre>
 *
 * EXECUTED, FAILED and CANCELLED are terminal.
 */
public enum OrderStatus {
    PENDING,
    EXECUTING,
    EXECUTED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == EXECUTED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return allowedTargets().contains(next);
    }

    private Set<OrderStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(EXECUTING, CANCELLED);
            case EXECUTING -> EnumSet.of(EXECUTED, PENDING, FAILED);
            case EXECUTED, FAILED, CANCELLED -> EnumSet.noneOf(OrderStatus.class);
        };
    }
}
