package com.continuum.relayer.domain.model;

import com.continuum.relayer.domain.enums.OrderOrigin;
import com.continuum.relayer.domain.enums.OrderStatus;
import java.math.BigInteger;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A swap order known to the relayer.
 *
 * <p>The orderId is assigned at intake; the sequence is assigned by the settlement program
 * and stays null until the engine sees the order on-ledger. Swap parameters never change
 * after creation. Only the OrderStore mutates status, attempts, result and error; everyone
 * else works with copies from {@link #snapshot()}.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String orderId;

    /** Ledger-assigned position in the FIFO queue. Null until observed on-ledger. */
    private Long sequence;

    private String poolId;
    private BigInteger amountIn;
    private BigInteger minAmountOut;
    private boolean baseInput;
    private String userAddress;

    /** Dedup fingerprint (user|pool|nonce). Null for adopted ledger orders. */
    private String fingerprint;

    @Builder.Default
    private OrderOrigin origin = OrderOrigin.INTAKE;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    private int attempts;

    /** Populated on EXECUTED. */
    private ExecutionResult result;

    /** Last failure reason. Kept across retries, final on FAILED. */
    private String error;

    /** Signature of the most recent transaction sent for this order, confirmed or not. */
    private String lastSignature;

    /** Signature of the user's submit transaction when it was relayed through intake. */
    private String submissionSignature;

    /** Bumped on every status change; lets subscribers drop replays. */
    private long version;

    private Instant createdAt;
    private Instant updatedAt;

    public Order snapshot() {
        return toBuilder().build();
    }
}
