package com.continuum.relayer.ledger;

import lombok.Builder;
import lombok.Value;

/** A signed execution transaction ready for {@link LedgerGateway#submit}. */
@Value
@Builder
public class SignedPayload {

    String orderId;
    long sequence;

    /** Serialized transaction, base64. */
    String transaction;

    /** Owner of the token account receiving the swap output. */
    String beneficiary;

    /** Mint of the output token, when known. Narrows the balance lookup for the output amount. */
    String outputMint;
}
