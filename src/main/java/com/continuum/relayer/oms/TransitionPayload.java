package com.continuum.relayer.oms;

import com.continuum.relayer.domain.model.ExecutionResult;
import lombok.Builder;
import lombok.Value;

/** Optional data recorded alongside a status change. Null fields leave the order untouched. */
@Value
@Builder
public class TransitionPayload {

    public static final TransitionPayload NONE = TransitionPayload.builder().build();

    /** Claim of an order whose outcome the ledger already holds; not an attempt by this relayer. */
    public static final TransitionPayload RECONCILED = TransitionPayload.builder().reconciled(true).build();

    ExecutionResult result;
    String error;
    String signature;
    boolean reconciled;

    public static TransitionPayload withResult(ExecutionResult result) {
        return TransitionPayload.builder()
                .result(result)
                .signature(result.getSignature())
                .build();
    }

    public static TransitionPayload withError(String error, String signature) {
        return TransitionPayload.builder().error(error).signature(signature).build();
    }
}
