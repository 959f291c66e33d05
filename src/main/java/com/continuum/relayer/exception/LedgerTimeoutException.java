package com.continuum.relayer.exception;

import com.continuum.relayer.domain.model.ExecutionFailure;
import java.time.Duration;

/** Confirmation did not arrive in time. Always transient: the transaction may still land. */
public class LedgerTimeoutException extends LedgerException {

    public LedgerTimeoutException(String signature, Duration waited) {
        super(
                ExecutionFailure.transientFailure(
                        "Confirmation timed out after " + waited.toMillis() + "ms for " + signature),
                signature,
                null);
    }
}
