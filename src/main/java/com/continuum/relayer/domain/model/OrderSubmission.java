package com.continuum.relayer.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Swap parameters accepted at intake. Immutable once the order exists.
 * The nonce is client-chosen and, together with user and pool, forms the dedup fingerprint.
 */
@Value
@Builder
public class OrderSubmission {

    String userAddress;
    String poolId;
    BigInteger amountIn;
    BigInteger minAmountOut;
    boolean baseInput;
    String nonce;

    public String fingerprint() {
        return String.join("|", userAddress, poolId, nonce);
    }
}
