package com.continuum.relayer.exception;

import com.continuum.relayer.domain.enums.OrderStatus;
import java.util.Map;
import lombok.Getter;

/**
 * Raised when a status change is not allowed by the order lifecycle, e.g. cancelling an
 * order the engine has already claimed. Callers treat this as "too late", not as a crash.
 */
@Getter
public class InvalidTransitionException extends BaseException {

    private final String orderId;
    private final OrderStatus from;
    private final OrderStatus to;

    public InvalidTransitionException(String orderId, OrderStatus from, OrderStatus to) {
        super(
                ErrorCode.INVALID_TRANSITION,
                String.format("Order %s cannot move from %s to %s", orderId, from, to),
                Map.of("orderId", orderId, "from", from.name(), "to", to.name()));
        this.orderId = orderId;
        this.from = from;
        this.to = to;
    }
}
