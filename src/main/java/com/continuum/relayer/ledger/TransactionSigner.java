package com.continuum.relayer.ledger;

/**
 * Holds the relayer key. Builds and signs the execution transaction for one order.
 * Failures are thrown as {@link com.continuum.relayer.exception.LedgerException}.
 */
public interface TransactionSigner {

    SignedPayload sign(ExecutionInstruction instruction);

    /** Public address of the relayer key. */
    String address();
}
