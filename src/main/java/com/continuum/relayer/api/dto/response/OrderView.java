package com.continuum.relayer.api.dto.response;

import com.continuum.relayer.domain.enums.OrderOrigin;
import com.continuum.relayer.domain.enums.OrderStatus;
import com.continuum.relayer.domain.model.ExecutionResult;
import com.continuum.relayer.domain.model.Order;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Read-only projection of an order for status queries and live snapshots. */
@Getter
@Builder
public class OrderView {

    private final String orderId;
    private final OrderStatus status;
    private final Long sequence;
    private final String poolId;
    private final String userAddress;
    private final BigInteger amountIn;
    private final BigInteger minAmountOut;
    private final boolean baseInput;
    private final int attempts;
    private final BigInteger actualAmountOut;
    private final BigDecimal executionPrice;
    private final String signature;
    private final Instant executedAt;
    private final String error;
    private final OrderOrigin origin;

    /** Bumped on every status change. */
    private final long version;

    private final Instant createdAt;
    private final Instant updatedAt;

    public static OrderView from(Order order) {
        ExecutionResult result = order.getResult();
        return OrderView.builder()
                .orderId(order.getOrderId())
                .status(order.getStatus())
                .sequence(order.getSequence())
                .poolId(order.getPoolId())
                .userAddress(order.getUserAddress())
                .amountIn(order.getAmountIn())
                .minAmountOut(order.getMinAmountOut())
                .baseInput(order.isBaseInput())
                .attempts(order.getAttempts())
                .actualAmountOut(result != null ? result.getActualAmountOut() : null)
                .executionPrice(result != null ? result.getEffectivePrice() : null)
                .signature(result != null && result.getSignature() != null ? result.getSignature() : order.getLastSignature())
                .executedAt(result != null ? result.getExecutedAt() : null)
                .error(order.getError())
                .origin(order.getOrigin())
                .version(order.getVersion())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
