package com.continuum.relayer.exception;

import com.continuum.relayer.domain.model.ExecutionFailure;
import lombok.Getter;

/**
 * Wraps every failure on the execution path: the ledger RPC, the settlement program or the
 * signing service.
 *
 * <p>The attached {@link ExecutionFailure} says whether the engine may retry. The signature
 * is set when a transaction was already sent before the failure, so a later retry can
 * check whether it landed.
 */
@Getter
public class LedgerException extends BaseException {

    private final ExecutionFailure failure;
    private final String signature;

    public LedgerException(ExecutionFailure failure) {
        this(failure, null, null);
    }

    public LedgerException(ExecutionFailure failure, Throwable cause) {
        this(failure, null, cause);
    }

    public LedgerException(ExecutionFailure failure, String signature, Throwable cause) {
        super(ErrorCode.LEDGER_ERROR, failure.reason(), null, cause);
        this.failure = failure;
        this.signature = signature;
    }

    public boolean isTransient() {
        return failure.isTransient();
    }
}
