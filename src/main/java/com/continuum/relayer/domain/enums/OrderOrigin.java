package com.continuum.relayer.domain.enums;

/** Where the relayer first learned about an order. */
public enum OrderOrigin {
    /** Submitted through this relayer's intake API. */
    INTAKE,
    /** Found on-ledger with no matching intake submission and adopted by the engine. */
    LEDGER
}
