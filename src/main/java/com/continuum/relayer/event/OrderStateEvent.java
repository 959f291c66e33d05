package com.continuum.relayer.event;

import com.continuum.relayer.domain.enums.OrderStatus;
import com.continuum.relayer.domain.model.Order;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One order state transition as delivered through the NotificationHub.
 *
 * <p>{@code version} is the order's version after the transition; subscribers use it to drop
 * replays. {@code previousStatus} is null for the creation event.
 */
@Value
@Builder
public class OrderStateEvent {

    String orderId;
    OrderStatus status;
    OrderStatus previousStatus;
    Long sequence;
    int attempts;
    String signature;
    String error;

    /** Backoff before the next attempt. Set only on a retry's return to PENDING. */
    Long retryDelayMs;

    long version;
    Instant timestamp;

    public static OrderStateEvent created(Order order) {
        return from(order, null, null);
    }

    public static OrderStateEvent transitioned(Order order, OrderStatus previousStatus) {
        return from(order, previousStatus, null);
    }

    public static OrderStateEvent retryScheduled(Order order, long retryDelayMs) {
        return from(order, OrderStatus.EXECUTING, retryDelayMs);
    }

    private static OrderStateEvent from(Order order, OrderStatus previousStatus, Long retryDelayMs) {
        String signature = order.getResult() != null ? order.getResult().getSignature() : order.getLastSignature();
        return OrderStateEvent.builder()
                .orderId(order.getOrderId())
                .status(order.getStatus())
                .previousStatus(previousStatus)
                .sequence(order.getSequence())
                .attempts(order.getAttempts())
                .signature(signature)
                .error(order.getError())
                .retryDelayMs(retryDelayMs)
                .version(order.getVersion())
                .timestamp(order.getUpdatedAt())
                .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
