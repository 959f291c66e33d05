package com.continuum.relayer.domain.model;

import com.continuum.relayer.domain.enums.LedgerOrderStatus;
import java.math.BigInteger;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An OrderState account as read from the settlement program. The ledger is authoritative
 * for sequence and status; the relayer only caches what it last observed.
 */
@Value
@Builder
public class OrderRecord {

    /** Address of the OrderState account. */
    String address;

    long sequence;
    String userAddress;
    String poolId;
    BigInteger amountIn;
    BigInteger minAmountOut;
    boolean baseInput;
    LedgerOrderStatus status;
    Instant submittedAt;

    /** Null until the program marks the order executed or cancelled. */
    Instant executedAt;

    /** True when the swap parameters equal those of the given intake submission. */
    public boolean matches(Order order) {
        return userAddress.equals(order.getUserAddress())
                && poolId.equals(order.getPoolId())
                && amountIn.equals(order.getAmountIn())
                && minAmountOut.equals(order.getMinAmountOut())
                && baseInput == order.isBaseInput();
    }
}
