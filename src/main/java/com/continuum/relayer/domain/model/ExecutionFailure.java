package com.continuum.relayer.domain.model;

import com.continuum.relayer.domain.enums.FailureKind;

/** Why an execution attempt failed, and whether it is worth retrying. */
public record ExecutionFailure(FailureKind kind, String reason) {

    public static ExecutionFailure transientFailure(String reason) {
        return new ExecutionFailure(FailureKind.TRANSIENT, reason);
    }

    public static ExecutionFailure permanentFailure(String reason) {
        return new ExecutionFailure(FailureKind.PERMANENT, reason);
    }

    public boolean isTransient() {
        return kind == FailureKind.TRANSIENT;
    }
}
