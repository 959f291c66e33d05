package com.continuum.relayer.ledger;

import com.continuum.relayer.domain.model.OrderRecord;
import com.continuum.relayer.exception.LedgerException;
import java.util.Optional;

/**
 * The engine's only view of the settlement program and the ledger network.
 *
 * <p>Reads are eventually consistent. Every method reports failures as {@link LedgerException},
 * classified as transient or permanent.
 */
public interface LedgerGateway {

    /** Highest sequence the settlement program has assigned so far. */
    long currentSequence();

    /** The OrderState account holding {@code sequence}, or empty if none exists. */
    Optional<OrderRecord> fetchOrder(long sequence);

    /**
     * Sends a relayer-signed execution transaction and waits for confirmation.
     * An on-ledger failure is returned as an unconfirmed result; timeouts throw
     * {@link com.continuum.relayer.exception.LedgerTimeoutException}.
     */
    TransactionResult submit(SignedPayload payload);

    /** Forwards a user-signed transaction without waiting for confirmation. Returns its signature. */
    String broadcast(String base64Transaction);
}
