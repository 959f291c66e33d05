package com.continuum.relayer.ledger;

import com.continuum.relayer.domain.model.ExecutionFailure;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/** Outcome of {@link LedgerGateway#submit}: a confirmed transaction or an on-ledger failure. */
@Value
@Builder
public class TransactionResult {

    String signature;
    boolean confirmed;

    /** Set when the transaction landed but failed. */
    ExecutionFailure error;

    /** Output credited to the user, when it could be read from the confirmed transaction. */
    BigInteger amountOut;

    public static TransactionResult confirmed(String signature, BigInteger amountOut) {
        return TransactionResult.builder().signature(signature).confirmed(true).amountOut(amountOut).build();
    }

    public static TransactionResult failed(String signature, ExecutionFailure error) {
        return TransactionResult.builder().signature(signature).confirmed(false).error(error).build();
    }
}
